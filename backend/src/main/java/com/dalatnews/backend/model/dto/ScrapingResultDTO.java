package com.dalatnews.backend.model.dto;

import com.dalatnews.backend.scraping.ScrapeOutcome;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScrapingResultDTO {
    // Deduplicated by source URL across all sources
    private List<ScrapedArticle> articles;
    private List<ScrapeOutcome> outcomes;
    private int totalScraped;
    private int duplicatesRemoved;
    private int failedSources;
    private String scrapedAt;
    private Double durationSeconds;
}
