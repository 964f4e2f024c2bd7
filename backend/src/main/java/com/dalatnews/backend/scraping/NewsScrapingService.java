package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.ScrapingResultDTO;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs every registered source scraper and merges their articles.
 */
@Service
@Slf4j
public class NewsScrapingService {

    private final List<NewsScraper> scrapers;
    private final ScrapingConfig scrapingConfig;
    private final Executor scrapingTaskExecutor;

    public NewsScrapingService(List<NewsScraper> scrapers,
                               ScrapingConfig scrapingConfig,
                               @Qualifier("scrapingTaskExecutor") Executor scrapingTaskExecutor) {
        this.scrapers = scrapers;
        this.scrapingConfig = scrapingConfig;
        this.scrapingTaskExecutor = scrapingTaskExecutor;
    }

    /**
     * Scrape articles from all sources. A failing source contributes a failed outcome and no
     * articles; it never aborts the others.
     */
    public ScrapingResultDTO scrapeAllSources() {
        log.info("Starting scraping for {} sources (parallel: {})",
                scrapers.size(), scrapingConfig.isParallelSourcesEnabled());
        long startTime = System.currentTimeMillis();

        List<ScrapeOutcome> outcomes = scrapingConfig.isParallelSourcesEnabled()
                ? runConcurrently()
                : scrapers.stream().map(ScrapeOutcome::capture).toList();

        Map<String, ScrapedArticle> bySourceUrl = new LinkedHashMap<>();
        int totalScraped = 0;
        int failedSources = 0;
        for (ScrapeOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failedSources++;
            }
            log.info("Source {}: {} articles in {}ms{}", outcome.getSourceId(), outcome.getArticles().size(),
                    outcome.getDurationMs(), outcome.isSuccess() ? "" : " (failed: " + outcome.getError() + ")");
            for (ScrapedArticle article : outcome.getArticles()) {
                totalScraped++;
                bySourceUrl.putIfAbsent(article.getSourceUrl(), article);
            }
        }

        double durationSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        ScrapingResultDTO result = new ScrapingResultDTO();
        result.setArticles(new ArrayList<>(bySourceUrl.values()));
        result.setOutcomes(outcomes);
        result.setTotalScraped(totalScraped);
        result.setDuplicatesRemoved(totalScraped - bySourceUrl.size());
        result.setFailedSources(failedSources);
        result.setScrapedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        result.setDurationSeconds(durationSeconds);

        log.info("Completed scraping all sources: {} unique articles, {} duplicates, {} failed sources",
                bySourceUrl.size(), result.getDuplicatesRemoved(), failedSources);
        return result;
    }

    private List<ScrapeOutcome> runConcurrently() {
        List<CompletableFuture<ScrapeOutcome>> futures = scrapers.stream()
                .map(scraper -> CompletableFuture.supplyAsync(() -> ScrapeOutcome.capture(scraper), scrapingTaskExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }
}
