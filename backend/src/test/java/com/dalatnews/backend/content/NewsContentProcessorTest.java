package com.dalatnews.backend.content;

import com.dalatnews.backend.ai.AiResponseException;
import com.dalatnews.backend.ai.TextGenerationClient;
import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.InternalLink;
import com.dalatnews.backend.model.dto.NewsContentOutput;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.enums.LinkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewsContentProcessorTest {

    @Mock
    private TextGenerationClient textGenerationClient;

    private NewsContentProcessor processor;
    private ArticleCluster cluster;

    @BeforeEach
    void setUp() {
        NewsPipelineProperties properties = new NewsPipelineProperties();
        properties.getSynthesis().setBaseDelayMs(1);
        processor = new NewsContentProcessor(textGenerationClient, properties);

        ScrapedArticle first = ScrapedArticle.builder()
                .sourceId("vnexpress").sourceUrl("https://vnexpress.net/hoa-1.html").sourceName("VnExpress")
                .title("Lễ hội hoa Đà Lạt khai mạc").content("Nội dung một")
                .imageUrls(List.of("https://cdn.vn/1.jpg"))
                .publishedAt("2025-12-20T19:00:00+07:00")
                .build();
        ScrapedArticle second = ScrapedArticle.builder()
                .sourceId("tuoitre").sourceUrl("https://tuoitre.vn/hoa-2.htm").sourceName("Tuổi Trẻ")
                .title("Festival hoa").content("Nội dung hai")
                .build();
        cluster = ArticleCluster.builder()
                .clusterId("cluster-1-0")
                .topicFingerprint("festival|flower")
                .keywords(List.of("festival", "flower"))
                .articles(List.of(first, second))
                .topic("Flower festival opens")
                .relevance(0.9)
                .newsworthiness(0.8)
                .build();
    }

    @Test
    @DisplayName("Full reply is mapped and quality factors derived from the cluster")
    void mapsFullReply() {
        // given
        when(textGenerationClient.generate(anyString(), anyString(), anyString(), anyInt())).thenReturn("""
                {
                  "title": "Da Lat flower festival opens",
                  "story_content": "## Opening night\\nThousands gathered, organisers said.",
                  "technical_content": "- When: 20 Dec",
                  "meta_description": "The festival opened.",
                  "seo_keywords": ["da lat", "festival"],
                  "suggested_slug": "da-lat-flower-festival-opens",
                  "news_tags": ["festival"],
                  "news_topic": "Festivals",
                  "image_descriptions": ["Lanterns over the lake"],
                  "internal_links": [
                    {"text": "Hồ Xuân Hương", "url": "/map", "type": "location"},
                    {"text": "Night market", "url": "/venues/night-market", "type": "shop"},
                    {"text": "", "url": "/events/x", "type": "event"},
                    "not an object"
                  ]
                }
                """);

        // when
        NewsContentOutput output = processor.processCluster(cluster);

        // then
        assertThat(output.getTitle()).isEqualTo("Da Lat flower festival opens");
        assertThat(output.getSeoKeywords()).containsExactly("da lat", "festival");
        assertThat(output.getNewsTopic()).isEqualTo("Festivals");
        assertThat(output.getInternalLinks()).containsExactly(
                new InternalLink("Hồ Xuân Hương", "/map", LinkType.LOCATION),
                new InternalLink("Night market", "/venues/night-market", LinkType.LOCATION));
        assertThat(output.getSourceUrls()).hasSize(2);
        assertThat(output.getSourceUrls().get(1).getPublisher()).isEqualTo("Tuổi Trẻ");
        assertThat(output.getQualityFactors().getSourceCount()).isEqualTo(2);
        assertThat(output.getQualityFactors().isHasDates()).isTrue();
        assertThat(output.getQualityFactors().isHasImages()).isTrue();
        assertThat(output.getQualityFactors().isHasNamedSources()).isTrue();
        assertThat(output.getQualityFactors().getContentLength()).isEqualTo(output.getStoryContent().length());
        assertThat(output.getQualityFactors().getDalatRelevance()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Missing fields fall back to defaults")
    void defaults() {
        when(textGenerationClient.generate(anyString(), anyString(), anyString(), anyInt()))
                .thenReturn("Sure! {\"story_content\": \"Short text.\"}");

        NewsContentOutput output = processor.processCluster(cluster);

        assertThat(output.getTitle()).isEqualTo("Lễ hội hoa Đà Lạt khai mạc");
        assertThat(output.getNewsTopic()).isEqualTo("festival, flower");
        assertThat(output.getSuggestedSlug()).isEmpty();
        assertThat(output.getTechnicalContent()).isEmpty();
        assertThat(output.getNewsTags()).isEmpty();
        assertThat(output.getInternalLinks()).isEmpty();
        assertThat(output.getQualityFactors().isHasNamedSources()).isFalse();
    }

    @Test
    @DisplayName("Overloaded service is retried")
    void retriesTransientError() {
        when(textGenerationClient.generate(anyString(), anyString(), anyString(), anyInt()))
                .thenThrow(new RuntimeException("529 overloaded_error"))
                .thenReturn("{\"title\": \"T\", \"story_content\": \"S\"}");

        NewsContentOutput output = processor.processCluster(cluster);

        assertThat(output.getTitle()).isEqualTo("T");
        verify(textGenerationClient, times(2)).generate(anyString(), anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("Exhausted retries surface the last error")
    void exhaustionIsFatal() {
        when(textGenerationClient.generate(anyString(), anyString(), anyString(), anyInt()))
                .thenThrow(new RuntimeException("503 first"), new RuntimeException("503 second"),
                        new RuntimeException("503 third"));

        assertThatThrownBy(() -> processor.processCluster(cluster))
                .isInstanceOf(ContentSynthesisException.class)
                .hasMessageContaining("503 third")
                .hasRootCauseMessage("503 third");
        verify(textGenerationClient, times(3)).generate(anyString(), anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("Unparseable reply fails without retrying")
    void parseErrorIsFatal() {
        when(textGenerationClient.generate(anyString(), anyString(), anyString(), anyInt()))
                .thenReturn("I am unable to write this article.");

        assertThatThrownBy(() -> processor.processCluster(cluster))
                .isInstanceOf(ContentSynthesisException.class)
                .hasCauseInstanceOf(AiResponseException.class);
        verify(textGenerationClient, times(1)).generate(anyString(), anyString(), anyString(), anyInt());
    }
}
