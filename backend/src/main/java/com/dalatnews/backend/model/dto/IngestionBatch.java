package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Value;

/**
 * Articles claimed for one processing pass, with how the scrape compared to the ledger.
 */
@Value
public class IngestionBatch {
    List<ScrapedArticle> articles;
    int newArticles;
    // Scraped URLs the ledger already held
    int alreadyIngested;
}
