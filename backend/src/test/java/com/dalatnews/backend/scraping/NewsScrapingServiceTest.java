package com.dalatnews.backend.scraping;

import com.dalatnews.backend.config.ScrapingConfig;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.ScrapingResultDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class NewsScrapingServiceTest {

    private static ScrapedArticle article(String sourceId, String url) {
        return ScrapedArticle.builder()
                .sourceId(sourceId)
                .sourceUrl(url)
                .sourceName(sourceId)
                .title("Tin Đà Lạt " + url)
                .content("Nội dung")
                .build();
    }

    private static NewsScraper scraper(String id, Supplier<List<ScrapedArticle>> body) {
        return new NewsScraper() {
            @Override
            public String getSourceId() {
                return id;
            }

            @Override
            public List<ScrapedArticle> scrape() {
                return body.get();
            }
        };
    }

    @Test
    @DisplayName("A throwing scraper is isolated and the others still run")
    void failingSourceIsIsolated() {
        // given
        NewsScraper broken = scraper("broken", () -> {
            throw new IllegalStateException("layout changed");
        });
        NewsScraper linkageFailure = scraper("missing-class", () -> {
            throw new NoClassDefFoundError("com/example/Gone");
        });
        NewsScraper healthy = scraper("healthy", () -> List.of(article("healthy", "https://a.vn/1.html")));
        Executor direct = Runnable::run;
        NewsScrapingService service = new NewsScrapingService(List.of(broken, linkageFailure, healthy),
                new ScrapingConfig(), direct);

        // when
        ScrapingResultDTO result = service.scrapeAllSources();

        // then
        assertThat(result.getArticles()).extracting(ScrapedArticle::getSourceUrl).containsExactly("https://a.vn/1.html");
        assertThat(result.getFailedSources()).isEqualTo(2);
        assertThat(result.getOutcomes()).extracting(ScrapeOutcome::getSourceId)
                .containsExactly("broken", "missing-class", "healthy");
        assertThat(result.getOutcomes().get(0).getError()).contains("layout changed");
    }

    @Test
    @DisplayName("Articles with the same source URL are kept once across sources")
    void deduplicatesBySourceUrl() {
        NewsScraper first = scraper("first", () -> List.of(
                article("first", "https://a.vn/1.html"), article("first", "https://a.vn/2.html")));
        NewsScraper second = scraper("second", () -> List.of(article("second", "https://a.vn/1.html")));
        NewsScrapingService service = new NewsScrapingService(List.of(first, second), new ScrapingConfig(), Runnable::run);

        ScrapingResultDTO result = service.scrapeAllSources();

        assertThat(result.getArticles()).hasSize(2);
        assertThat(result.getArticles().get(0).getSourceId()).isEqualTo("first");
        assertThat(result.getTotalScraped()).isEqualTo(3);
        assertThat(result.getDuplicatesRemoved()).isEqualTo(1);
    }

    @Test
    @DisplayName("Parallel mode runs sources on the executor and keeps source order")
    void parallelSources() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            ScrapingConfig config = new ScrapingConfig();
            config.setParallelSourcesEnabled(true);
            NewsScraper slow = scraper("slow", () -> {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(article("slow", "https://a.vn/slow.html"));
            });
            NewsScraper fast = scraper("fast", () -> List.of(article("fast", "https://a.vn/fast.html")));
            NewsScrapingService service = new NewsScrapingService(List.of(slow, fast), config, executor);

            ScrapingResultDTO result = service.scrapeAllSources();

            assertThat(result.getArticles()).extracting(ScrapedArticle::getSourceId).containsExactly("slow", "fast");
            assertThat(result.getFailedSources()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }
}
