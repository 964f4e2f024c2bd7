package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Articles believed to describe the same story, grouped against the keywords of the seed article.
 */
@Value
@Builder
public class ArticleCluster {
    String clusterId;
    String topicFingerprint;
    List<String> keywords;
    List<ScrapedArticle> articles;
    // One-line topic of the seed article
    String topic;
    // Means of the members' keyword-extraction scores
    double relevance;
    double newsworthiness;
}
