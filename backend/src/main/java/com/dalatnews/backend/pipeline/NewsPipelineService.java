package com.dalatnews.backend.pipeline;

import com.dalatnews.backend.clustering.TopicClusteringService;
import com.dalatnews.backend.content.NewsContentProcessor;
import com.dalatnews.backend.db.entity.NewsPost;
import com.dalatnews.backend.ingestion.RawArticleLedger;
import com.dalatnews.backend.linking.InternalLinker;
import com.dalatnews.backend.linking.LinkDictionaryCache;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.ClusteringResult;
import com.dalatnews.backend.model.dto.IngestionBatch;
import com.dalatnews.backend.model.dto.NewsContentOutput;
import com.dalatnews.backend.model.dto.NewsPipelineReport;
import com.dalatnews.backend.model.dto.QualityScore;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.ScrapingResultDTO;
import com.dalatnews.backend.model.dto.SynthesizedNewsArticle;
import com.dalatnews.backend.post.NewsPostService;
import com.dalatnews.backend.quality.QualityScorer;
import com.dalatnews.backend.scraping.NewsScrapingService;
import com.dalatnews.backend.scraping.ScrapeOutcome;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One batch pass: scrape → ingest → cluster → synthesize → score → link → persist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewsPipelineService {

    private final NewsScrapingService scrapingService;
    private final TopicClusteringService clusteringService;
    private final NewsContentProcessor contentProcessor;
    private final QualityScorer qualityScorer;
    private final InternalLinker internalLinker;
    private final LinkDictionaryCache linkDictionaryCache;
    private final NewsPostService newsPostService;
    private final RawArticleLedger rawArticleLedger;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @throws PipelineAlreadyRunningException when another run has not finished yet
     */
    public NewsPipelineReport runPipeline() {
        if (!running.compareAndSet(false, true)) {
            throw new PipelineAlreadyRunningException();
        }
        try {
            long startTime = System.currentTimeMillis();
            NewsPipelineReport report = new NewsPipelineReport();
            report.setStartedAt(now());
            log.info("🚀 News pipeline started");

            linkDictionaryCache.invalidate();
            rawArticleLedger.releaseProcessing();

            ScrapingResultDTO scraping = scrapingService.scrapeAllSources();
            report.setScraped(scraping.getArticles().size());
            for (ScrapeOutcome outcome : scraping.getOutcomes()) {
                report.getSources().add(new NewsPipelineReport.SourceSummary(
                        outcome.getSourceId(), outcome.getArticles().size(), outcome.isSuccess(), outcome.getError()));
            }

            IngestionBatch batch = rawArticleLedger.admit(scraping.getArticles());
            report.setAlreadyIngested(batch.getAlreadyIngested());
            try {
                processArticles(batch.getArticles(), report);
            } catch (RuntimeException e) {
                rawArticleLedger.releaseProcessing();
                throw e;
            }

            report.setFinishedAt(now());
            report.setDurationSeconds((System.currentTimeMillis() - startTime) / 1000.0);
            log.info("📈 News pipeline completed: {} scraped, {} clusters, {} posts ({} published), {} duplicates, {} errors",
                    report.getScraped(), report.getClusters(), report.getPostsCreated(), report.getPublished(),
                    report.getDuplicates(), report.getErrors());
            return report;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cluster the given articles and create one post per new story, recording each article's
     * outcome in the ingestion ledger. A failing cluster is counted as an error and does not
     * stop the others.
     */
    public NewsPipelineReport processArticles(List<ScrapedArticle> articles, NewsPipelineReport report) {
        report.setQueued(articles.size());
        if (articles.isEmpty()) {
            log.info("No articles to process");
            return report;
        }

        ClusteringResult clustering = clusteringService.clusterArticles(articles);
        report.setClusters(clustering.getClusters().size());
        report.setSkipped(clustering.getSkipped().size());
        report.setAiCalls(clustering.getApiCalls());
        rawArticleLedger.markSkipped(clustering.getSkipped());

        for (ArticleCluster cluster : clustering.getClusters()) {
            try {
                Optional<NewsPost> existing = newsPostService.findByFingerprint(cluster.getTopicFingerprint());
                if (existing.isPresent()) {
                    log.info("Duplicate cluster skipped: {}", String.join(", ", cluster.getKeywords()));
                    rawArticleLedger.markProcessed(cluster, existing.get().getId());
                    report.setDuplicates(report.getDuplicates() + 1);
                    continue;
                }

                report.setAiCalls(report.getAiCalls() + 1);
                SynthesizedNewsArticle synthesized = synthesize(cluster);
                NewsPost saved = newsPostService.save(synthesized);
                rawArticleLedger.markProcessed(cluster, saved.getId());

                report.setPostsCreated(report.getPostsCreated() + 1);
                switch (synthesized.getQuality().getSuggestedStatus()) {
                    case PUBLISHED -> report.setPublished(report.getPublished() + 1);
                    case EXPERIMENTAL -> report.setExperimental(report.getExperimental() + 1);
                    case DRAFT -> report.setDrafts(report.getDrafts() + 1);
                }
            } catch (RuntimeException e) {
                log.error("❌ Cluster {} failed: {}", cluster.getClusterId(), e.getMessage());
                report.addError(cluster.getClusterId() + ": " + e.getMessage());
                rawArticleLedger.markError(cluster, e.getMessage());
            }
        }
        return report;
    }

    SynthesizedNewsArticle synthesize(ArticleCluster cluster) {
        NewsContentOutput content = contentProcessor.processCluster(cluster);

        QualityScore quality = qualityScorer.score(content, cluster.getNewsworthiness(), cluster.getRelevance());
        log.info("Quality {} → {} for \"{}\"", quality.getTotal(), quality.getSuggestedStatus().getValue(), content.getTitle());

        return SynthesizedNewsArticle.builder()
                .cluster(cluster)
                .content(content)
                .quality(quality)
                .linkedStoryContent(internalLinker.applyInternalLinks(content.getStoryContent(), content.getInternalLinks()))
                .linkedTechnicalContent(internalLinker.applyInternalLinks(content.getTechnicalContent()))
                .build();
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
