package com.dalatnews.backend.content;

import com.dalatnews.backend.ai.AiCallRetrier;
import com.dalatnews.backend.ai.AiJsonResponseParser;
import com.dalatnews.backend.ai.TextGenerationClient;
import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.InternalLink;
import com.dalatnews.backend.model.dto.NewsContentOutput;
import com.dalatnews.backend.model.dto.QualityFactors;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.SourceAttribution;
import com.dalatnews.backend.model.enums.LinkType;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a cluster of source articles into one original article through a single synthesis
 * call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewsContentProcessor {

    // Scored properly later by the quality scorer
    static final double PLACEHOLDER_DALAT_RELEVANCE = 0.8;

    private static final Pattern NAMED_SOURCES =
            Pattern.compile("according to|said|told|reported", Pattern.CASE_INSENSITIVE);

    private static final String SYNTHESIS_SYSTEM_PROMPT = """
            You are a local journalist writing for a community website about Da Lat, Vietnam.
            You receive several reports of the same story from Vietnamese outlets. Write one
            original English article from them. Do not copy sentences; attribute facts to the
            outlets or people who stated them ("according to", "said"). Keep dates, names and
            numbers exact.

            Respond with JSON only, using exactly these keys:
            {
              "title": "headline, under 80 characters",
              "story_content": "markdown article for readers, 300-600 words, with ## subheadings",
              "technical_content": "markdown fact sheet: who, what, when, where, sources",
              "meta_description": "under 160 characters",
              "seo_keywords": ["..."],
              "suggested_slug": "lowercase-ascii-words",
              "news_tags": ["..."],
              "news_topic": "short topic label",
              "image_descriptions": ["description of a cover photo for this story"],
              "internal_links": [{"text": "exact phrase from story_content", "url": "/events/... or /venues/... or /map", "type": "event|venue|location"}]
            }
            """;

    private final TextGenerationClient textGenerationClient;
    private final NewsPipelineProperties pipelineProperties;

    /**
     * @throws ContentSynthesisException when every attempt failed or the reply was unusable
     */
    public NewsContentOutput processCluster(ArticleCluster cluster) {
        NewsPipelineProperties.Synthesis settings = pipelineProperties.getSynthesis();
        String userPrompt = buildRewritePrompt(cluster, settings.getContentCharLimit());
        log.info("🤖 Synthesizing article for {} ({} sources)", cluster.getClusterId(), cluster.getArticles().size());

        try {
            return AiCallRetrier.execute("synthesis of " + cluster.getClusterId(),
                    settings.getMaxAttempts(), settings.getBaseDelayMs(), () -> {
                        String text = textGenerationClient.generate(
                                SYNTHESIS_SYSTEM_PROMPT, userPrompt, settings.getModel(), settings.getMaxTokens());
                        return toContentOutput(cluster, AiJsonResponseParser.parseObject(text));
                    });
        } catch (RuntimeException e) {
            log.error("❌ Synthesis failed for {}: {}", cluster.getClusterId(), e.getMessage());
            throw new ContentSynthesisException(cluster.getClusterId(), e);
        }
    }

    static NewsContentOutput toContentOutput(ArticleCluster cluster, JsonNode parsed) {
        List<ScrapedArticle> articles = cluster.getArticles();
        String storyContent = text(parsed, "story_content");
        String title = text(parsed, "title");
        String newsTopic = text(parsed, "news_topic");

        List<SourceAttribution> sourceUrls = articles.stream()
                .map(a -> SourceAttribution.builder()
                        .url(a.getSourceUrl())
                        .title(a.getTitle())
                        .publisher(a.getSourceName())
                        .publishedAt(a.getPublishedAt())
                        .build())
                .toList();

        QualityFactors factors = QualityFactors.builder()
                .sourceCount(articles.size())
                .hasDates(articles.stream().anyMatch(a -> a.getPublishedAt() != null && !a.getPublishedAt().isEmpty()))
                .hasNamedSources(NAMED_SOURCES.matcher(storyContent).find())
                .hasImages(articles.stream().anyMatch(ScrapedArticle::hasImages))
                .contentLength(storyContent.length())
                .dalatRelevance(PLACEHOLDER_DALAT_RELEVANCE)
                .build();

        return NewsContentOutput.builder()
                .title(title.isEmpty() ? articles.get(0).getTitle() : title)
                .storyContent(storyContent)
                .technicalContent(text(parsed, "technical_content"))
                .metaDescription(text(parsed, "meta_description"))
                .seoKeywords(textList(parsed, "seo_keywords"))
                .suggestedSlug(text(parsed, "suggested_slug"))
                .newsTags(textList(parsed, "news_tags"))
                .newsTopic(newsTopic.isEmpty() ? String.join(", ", cluster.getKeywords()) : newsTopic)
                .imageDescriptions(textList(parsed, "image_descriptions"))
                .sourceUrls(sourceUrls)
                .internalLinks(internalLinks(parsed.get("internal_links")))
                .qualityFactors(factors)
                .build();
    }

    // Entries without text or url are dropped
    static List<InternalLink> internalLinks(JsonNode node) {
        List<InternalLink> links = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return links;
        }
        for (JsonNode entry : node) {
            if (!entry.isObject()) continue;
            String linkText = text(entry, "text");
            String url = text(entry, "url");
            if (linkText.isBlank() || url.isBlank()) continue;
            links.add(new InternalLink(linkText, url, LinkType.fromValue(text(entry, "type"))));
        }
        return links;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    private static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> values = new ArrayList<>();
        if (value != null && value.isArray()) {
            for (JsonNode item : value) {
                if (item.isTextual()) values.add(item.asText());
            }
        }
        return values;
    }

    private static String buildRewritePrompt(ArticleCluster cluster, int contentCharLimit) {
        StringBuilder prompt = new StringBuilder("Source articles about the same story:\n\n");
        int n = 1;
        for (ScrapedArticle article : cluster.getArticles()) {
            String content = article.getContent();
            if (content.length() > contentCharLimit) {
                content = content.substring(0, contentCharLimit);
            }
            prompt.append("--- Article ").append(n++).append(" ---\n")
                    .append("Title: ").append(article.getTitle()).append('\n')
                    .append("Source: ").append(article.getSourceName()).append('\n')
                    .append("URL: ").append(article.getSourceUrl()).append('\n')
                    .append("Content:\n").append(content).append("\n\n");
        }
        return prompt.toString();
    }
}
