package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Value;

@Value
public class ClusteringResult {
    List<ArticleCluster> clusters;
    // Extraction failures and low-relevance articles
    List<ScrapedArticle> skipped;
    int apiCalls;
}
