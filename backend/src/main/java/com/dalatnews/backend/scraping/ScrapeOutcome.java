package com.dalatnews.backend.scraping;

import com.dalatnews.backend.model.dto.ScrapedArticle;
import java.util.List;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Result of running one scraper: its articles, or the reason it produced none.
 */
@Value
@Slf4j
public class ScrapeOutcome {
    String sourceId;
    List<ScrapedArticle> articles;
    boolean success;
    String error;
    long durationMs;

    /**
     * Run {@code scraper} so that no failure escapes: any exception or linkage error becomes a
     * failed outcome with no articles.
     */
    public static ScrapeOutcome capture(NewsScraper scraper) {
        long start = System.currentTimeMillis();
        String sourceId = scraper.getSourceId();
        try {
            List<ScrapedArticle> articles = scraper.scrape();
            return new ScrapeOutcome(sourceId, articles == null ? List.of() : List.copyOf(articles),
                    true, null, System.currentTimeMillis() - start);
        } catch (Exception | LinkageError e) {
            log.error("Scraper {} failed: {}", sourceId, e.toString());
            return new ScrapeOutcome(sourceId, List.of(), false, e.toString(), System.currentTimeMillis() - start);
        }
    }
}
