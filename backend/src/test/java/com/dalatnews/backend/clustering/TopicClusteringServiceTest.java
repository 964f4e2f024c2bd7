package com.dalatnews.backend.clustering;

import com.dalatnews.backend.ai.TextGenerationClient;
import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.model.dto.ClusteringResult;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.TopicExtraction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TopicClusteringServiceTest {

    @Mock
    private TextGenerationClient textGenerationClient;

    private TopicClusteringService service;

    @BeforeEach
    void setUp() {
        NewsPipelineProperties properties = new NewsPipelineProperties();
        properties.getClustering().setInterCallDelayMs(0);
        properties.getClustering().setBaseDelayMs(1);
        service = new TopicClusteringService(textGenerationClient, properties);
    }

    private static ScrapedArticle article(String title) {
        return ScrapedArticle.builder()
                .sourceId("test")
                .sourceUrl("https://news.example.vn/" + title.hashCode() + ".html")
                .sourceName("Test")
                .title(title)
                .content("Nội dung bài viết về " + title)
                .build();
    }

    private static String reply(double relevance, String... keywords) {
        return "```json\n{\"keywords\": [\"" + String.join("\", \"", keywords) + "\"], "
                + "\"topic\": \"story\", \"dalat_relevance\": " + relevance + ", \"newsworthiness\": 0.7}\n```";
    }

    private void stubReply(String title, String reply) {
        when(textGenerationClient.generate(anyString(), contains("Title: " + title), anyString(), anyInt()))
                .thenReturn(reply);
    }

    @Test
    @DisplayName("Keyword extraction asks for three to five keywords with the small model")
    void extractionPromptContract() {
        stubReply("Festival", reply(0.9, "flower", "festival", "da lat"));

        service.clusterArticles(List.of(article("Festival")));

        ArgumentCaptor<String> systemPrompt = ArgumentCaptor.forClass(String.class);
        verify(textGenerationClient).generate(systemPrompt.capture(), contains("Title: Festival"),
                eq("claude-haiku-4-5-20251001"), eq(256));
        assertThat(systemPrompt.getValue()).contains("3-5 short lowercase keywords").doesNotContain("5-8");
    }

    @Test
    @DisplayName("Relevance 0.29 is skipped, 0.30 is clustered")
    void relevanceGate() {
        // given
        stubReply("Below", reply(0.29, "a", "b"));
        stubReply("Boundary", reply(0.30, "c", "d"));

        // when
        ClusteringResult result = service.clusterArticles(List.of(article("Below"), article("Boundary")));

        // then
        assertThat(result.getSkipped()).extracting(ScrapedArticle::getTitle).containsExactly("Below");
        assertThat(result.getClusters()).hasSize(1);
        assertThat(result.getClusters().get(0).getArticles()).extracting(ScrapedArticle::getTitle)
                .containsExactly("Boundary");
        assertThat(result.getApiCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Articles about the same story end up in one cluster")
    void groupsSameStory() {
        stubReply("Lễ hội hoa", reply(0.9, "festival", "flower", "da lat"));
        stubReply("Festival hoa", reply(0.8, "festival", "flower", "da lat", "tourists"));
        stubReply("Giá rau", reply(0.7, "vegetables", "price", "market"));

        ClusteringResult result = service.clusterArticles(
                List.of(article("Lễ hội hoa"), article("Festival hoa"), article("Giá rau")));

        assertThat(result.getClusters()).hasSize(2);
        assertThat(result.getClusters().get(0).getArticles()).hasSize(2);
        assertThat(result.getClusters().get(0).getTopicFingerprint()).isEqualTo("da lat|festival|flower|tourists");
        assertThat(result.getClusters().get(0).getRelevance()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Rate-limited call is retried and the article kept")
    void transientErrorIsRetried() {
        when(textGenerationClient.generate(anyString(), contains("Title: Mưa"), anyString(), anyInt()))
                .thenThrow(new RuntimeException("429 rate_limit_error"))
                .thenReturn(reply(0.9, "rain", "flood"));

        ClusteringResult result = service.clusterArticles(List.of(article("Mưa")));

        assertThat(result.getClusters()).hasSize(1);
        assertThat(result.getApiCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Permanent error skips the article after one call")
    void permanentErrorSkips() {
        when(textGenerationClient.generate(anyString(), contains("Title: Lỗi"), anyString(), anyInt()))
                .thenThrow(new RuntimeException("invalid_request_error"));

        ClusteringResult result = service.clusterArticles(List.of(article("Lỗi")));

        assertThat(result.getClusters()).isEmpty();
        assertThat(result.getSkipped()).hasSize(1);
        verify(textGenerationClient, times(1)).generate(anyString(), anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("Empty keyword list counts as an extraction failure")
    void emptyKeywordsSkip() {
        stubReply("Trống", "{\"keywords\": [], \"topic\": \"x\", \"dalat_relevance\": 0.9}");

        ClusteringResult result = service.clusterArticles(List.of(article("Trống")));

        assertThat(result.getSkipped()).hasSize(1);
        assertThat(result.getClusters()).isEmpty();
    }

    @Test
    @DisplayName("Non-numeric or out-of-range scores default to 0.5")
    void invalidScoresDefault() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        TopicExtraction extraction = TopicClusteringService.toExtraction(mapper.readTree(
                "{\"keywords\": [\"a\"], \"dalat_relevance\": \"high\", \"newsworthiness\": 1.7}"));
        TopicExtraction missing = TopicClusteringService.toExtraction(mapper.readTree("{\"keywords\": [\"a\"]}"));

        assertThat(extraction.getDalatRelevance()).isEqualTo(0.5);
        assertThat(extraction.getNewsworthiness()).isEqualTo(0.5);
        assertThat(missing.getDalatRelevance()).isEqualTo(0.5);
        assertThat(missing.getTopic()).isEmpty();
        assertThatThrownBy(() -> TopicClusteringService.toExtraction(mapper.readTree("{\"topic\": \"x\"}")))
                .hasMessageContaining("no keywords");
    }
}
