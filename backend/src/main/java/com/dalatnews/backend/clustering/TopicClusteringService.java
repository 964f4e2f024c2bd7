package com.dalatnews.backend.clustering;

import com.dalatnews.backend.ai.AiCallRetrier;
import com.dalatnews.backend.ai.AiJsonResponseParser;
import com.dalatnews.backend.ai.AiResponseException;
import com.dalatnews.backend.ai.TextGenerationClient;
import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.ClusteringResult;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.TopicExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Groups scraped articles that describe the same story, using keywords extracted per article
 * by the text-generation service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicClusteringService {

    static final double DEFAULT_SCORE = 0.5;

    private static final String CLUSTERING_SYSTEM_PROMPT = """
            You analyse Vietnamese local news about Da Lat and Lam Dong province.
            For the article you are given, extract what identifies the real-world story it reports,
            so that articles from different outlets about the same story get the same keywords.

            Respond with JSON only, in exactly this shape:
            {
              "keywords": ["3-5 short lowercase keywords: people, organisations, places, event type"],
              "topic": "one-line English summary of the story",
              "dalat_relevance": 0.0,
              "newsworthiness": 0.0
            }

            dalat_relevance: 1.0 when the story happens in Da Lat, 0.5 for elsewhere in Lam Dong,
            0.0 when unrelated. newsworthiness: 1.0 for major community news, 0.0 for filler.
            """;

    private final TextGenerationClient textGenerationClient;
    private final NewsPipelineProperties pipelineProperties;

    /**
     * Extract keywords for every article, drop failures and low-relevance articles, then group
     * the rest greedily by fingerprint similarity.
     */
    public ClusteringResult clusterArticles(List<ScrapedArticle> articles) {
        NewsPipelineProperties.Clustering settings = pipelineProperties.getClustering();
        AtomicInteger apiCalls = new AtomicInteger();
        List<KeywordedArticle> keyworded = new ArrayList<>();
        List<ScrapedArticle> skipped = new ArrayList<>();

        for (int i = 0; i < articles.size(); i++) {
            ScrapedArticle article = articles.get(i);
            TopicExtraction extraction = extractTopicKeywords(article, apiCalls);
            boolean interrupted = !pause(settings.getInterCallDelayMs());

            if (extraction == null) {
                skipped.add(article);
            } else if (extraction.getDalatRelevance() < settings.getMinRelevance()) {
                log.info("Skipping low-relevance article ({}): {}", extraction.getDalatRelevance(), article.getTitle());
                skipped.add(article);
            } else {
                keyworded.add(KeywordedArticle.of(article, extraction));
            }

            if (interrupted) {
                log.warn("Clustering interrupted, skipping {} remaining articles", articles.size() - i - 1);
                skipped.addAll(articles.subList(i + 1, articles.size()));
                break;
            }
        }

        List<ArticleCluster> clusters = groupBySimilarity(keyworded, settings.getSimilarityThreshold());
        log.info("Created {} clusters from {} articles ({} skipped)", clusters.size(), articles.size(), skipped.size());
        return new ClusteringResult(clusters, skipped, apiCalls.get());
    }

    /**
     * One keyword-extraction call, retried on transient errors.
     *
     * @return the extraction, or {@code null} when the article should be skipped
     */
    TopicExtraction extractTopicKeywords(ScrapedArticle article, AtomicInteger apiCalls) {
        NewsPipelineProperties.Clustering settings = pipelineProperties.getClustering();
        String userPrompt = buildClusteringPrompt(article, settings.getContentCharLimit());
        try {
            return AiCallRetrier.execute("keyword extraction", settings.getMaxAttempts(), settings.getBaseDelayMs(), () -> {
                apiCalls.incrementAndGet();
                String text = textGenerationClient.generate(
                        CLUSTERING_SYSTEM_PROMPT, userPrompt, settings.getModel(), settings.getMaxTokens());
                return toExtraction(AiJsonResponseParser.parseObject(text));
            });
        } catch (AiResponseException e) {
            log.warn("No keywords extracted for \"{}\": {}", article.getTitle(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Failed to extract keywords for \"{}\": {}", article.getTitle(), e.getMessage());
            return null;
        }
    }

    static TopicExtraction toExtraction(JsonNode node) {
        JsonNode keywordsNode = node.get("keywords");
        List<String> keywords = new ArrayList<>();
        if (keywordsNode != null && keywordsNode.isArray()) {
            for (JsonNode k : keywordsNode) {
                if (k.isTextual() && !k.asText().isBlank()) {
                    keywords.add(k.asText().trim());
                }
            }
        }
        if (keywords.isEmpty()) {
            throw new AiResponseException("Response carries no keywords");
        }
        JsonNode topic = node.get("topic");
        return new TopicExtraction(
                keywords,
                topic != null && topic.isTextual() ? topic.asText() : "",
                score(node.get("dalat_relevance")),
                score(node.get("newsworthiness")));
    }

    static double score(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return DEFAULT_SCORE;
        }
        double d = value.asDouble();
        return d >= 0.0 && d <= 1.0 ? d : DEFAULT_SCORE;
    }

    /**
     * Greedy single pass: each unassigned article seeds a cluster and absorbs every later
     * unassigned article whose fingerprint is at least {@code threshold} similar to the seed's.
     * Membership is judged against the seed only, so the grouping is not transitive.
     */
    public static List<ArticleCluster> groupBySimilarity(List<KeywordedArticle> articles, double threshold) {
        List<ArticleCluster> clusters = new ArrayList<>();
        boolean[] assigned = new boolean[articles.size()];
        long now = System.currentTimeMillis();

        for (int i = 0; i < articles.size(); i++) {
            if (assigned[i]) continue;
            assigned[i] = true;

            KeywordedArticle seed = articles.get(i);
            List<KeywordedArticle> members = new ArrayList<>();
            members.add(seed);
            Map<String, String> allKeywords = new LinkedHashMap<>();
            addKeywords(allKeywords, seed.getKeywords());

            for (int j = i + 1; j < articles.size(); j++) {
                if (assigned[j]) continue;
                KeywordedArticle candidate = articles.get(j);
                if (TopicFingerprint.similarity(seed.getFingerprint(), candidate.getFingerprint()) >= threshold) {
                    members.add(candidate);
                    addKeywords(allKeywords, candidate.getKeywords());
                    assigned[j] = true;
                }
            }

            List<String> keywords = new ArrayList<>(allKeywords.values());
            clusters.add(ArticleCluster.builder()
                    .clusterId("cluster-" + now + "-" + i)
                    .topicFingerprint(TopicFingerprint.of(keywords))
                    .keywords(keywords)
                    .articles(members.stream().map(KeywordedArticle::getArticle).toList())
                    .topic(seed.getTopic())
                    .relevance(members.stream().mapToDouble(KeywordedArticle::getRelevance).average().orElse(0.0))
                    .newsworthiness(members.stream().mapToDouble(KeywordedArticle::getNewsworthiness).average().orElse(0.0))
                    .build());
        }
        return clusters;
    }

    private static void addKeywords(Map<String, String> target, List<String> keywords) {
        for (String keyword : keywords) {
            target.putIfAbsent(keyword.toLowerCase(Locale.ROOT).trim(), keyword);
        }
    }

    private static String buildClusteringPrompt(ScrapedArticle article, int contentCharLimit) {
        String content = article.getContent();
        if (content.length() > contentCharLimit) {
            content = content.substring(0, contentCharLimit);
        }
        return "Title: " + article.getTitle() + "\n\nContent:\n" + content;
    }

    private static boolean pause(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
