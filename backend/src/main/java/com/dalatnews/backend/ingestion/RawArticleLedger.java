package com.dalatnews.backend.ingestion;

import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.db.entity.NewsRawArticle;
import com.dalatnews.backend.db.repository.NewsRawArticleRepository;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.IngestionBatch;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.enums.RawArticleStatus;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Remembers every scraped article by source URL across runs and tracks where it is in the
 * pipeline: pending, processing, then processed, skipped or error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawArticleLedger {

    private final NewsRawArticleRepository rawArticleRepository;
    private final NewsPipelineProperties pipelineProperties;

    /**
     * Store unseen articles as pending, then claim the oldest pending and retryable articles
     * for this run by marking them processing.
     */
    @Transactional
    public IngestionBatch admit(List<ScrapedArticle> scraped) {
        NewsPipelineProperties.Ingestion settings = pipelineProperties.getIngestion();

        Set<String> known = rawArticleRepository.findBySourceUrlIn(urls(scraped)).stream()
                .map(NewsRawArticle::getSourceUrl)
                .collect(Collectors.toSet());

        List<NewsRawArticle> fresh = new ArrayList<>();
        for (ScrapedArticle article : scraped) {
            if (known.contains(article.getSourceUrl())) continue;
            fresh.add(toEntity(article));
        }
        if (!fresh.isEmpty()) {
            rawArticleRepository.saveAll(fresh);
        }

        List<NewsRawArticle> queue = rawArticleRepository.findProcessingQueue(
                settings.getMaxAttempts(), PageRequest.of(0, settings.getBatchSize()));
        for (NewsRawArticle row : queue) {
            row.setStatus(RawArticleStatus.PROCESSING.getValue());
            row.setAttempts(row.getAttempts() + 1);
        }
        rawArticleRepository.saveAll(queue);

        log.info("Ingested {} new articles ({} already known), {} queued for processing",
                fresh.size(), known.size(), queue.size());
        return new IngestionBatch(queue.stream().map(RawArticleLedger::toScrapedArticle).toList(),
                fresh.size(), known.size());
    }

    @Transactional
    public void markSkipped(List<ScrapedArticle> articles) {
        if (articles.isEmpty()) return;
        OffsetDateTime now = now();
        List<NewsRawArticle> rows = rawArticleRepository.findBySourceUrlIn(urls(articles));
        for (NewsRawArticle row : rows) {
            row.setStatus(RawArticleStatus.SKIPPED.getValue());
            row.setProcessedAt(now);
        }
        rawArticleRepository.saveAll(rows);
    }

    /**
     * Record that the cluster's articles are covered by a post, new or pre-existing.
     */
    @Transactional
    public void markProcessed(ArticleCluster cluster, UUID newsPostId) {
        OffsetDateTime now = now();
        List<NewsRawArticle> rows = rawArticleRepository.findBySourceUrlIn(urls(cluster.getArticles()));
        for (NewsRawArticle row : rows) {
            row.setStatus(RawArticleStatus.PROCESSED.getValue());
            row.setNewsPostId(newsPostId);
            row.setClusterId(cluster.getClusterId());
            row.setTopicFingerprint(cluster.getTopicFingerprint());
            row.setTopicKeywords(new ArrayList<>(cluster.getKeywords()));
            row.setProcessedAt(now);
            row.setErrorMessage(null);
        }
        rawArticleRepository.saveAll(rows);
    }

    @Transactional
    public void markError(ArticleCluster cluster, String message) {
        List<NewsRawArticle> rows = rawArticleRepository.findBySourceUrlIn(urls(cluster.getArticles()));
        for (NewsRawArticle row : rows) {
            row.setStatus(RawArticleStatus.ERROR.getValue());
            row.setClusterId(cluster.getClusterId());
            row.setErrorMessage(message);
        }
        rawArticleRepository.saveAll(rows);
    }

    /**
     * Return articles left in processing by an aborted run to pending.
     *
     * @return how many were released
     */
    @Transactional
    public int releaseProcessing() {
        List<NewsRawArticle> stuck = rawArticleRepository.findByStatus(RawArticleStatus.PROCESSING.getValue());
        for (NewsRawArticle row : stuck) {
            row.setStatus(RawArticleStatus.PENDING.getValue());
        }
        if (!stuck.isEmpty()) {
            rawArticleRepository.saveAll(stuck);
            log.warn("Released {} articles stuck in processing back to pending", stuck.size());
        }
        return stuck.size();
    }

    private static List<String> urls(List<ScrapedArticle> articles) {
        return articles.stream().map(ScrapedArticle::getSourceUrl).toList();
    }

    static NewsRawArticle toEntity(ScrapedArticle article) {
        return NewsRawArticle.builder()
                .sourceId(article.getSourceId())
                .sourceUrl(article.getSourceUrl())
                .sourceName(article.getSourceName())
                .title(article.getTitle())
                .content(article.getContent())
                .imageUrls(article.getImageUrls() == null ? new ArrayList<>() : new ArrayList<>(article.getImageUrls()))
                .publishedAt(article.getPublishedAt())
                .status(RawArticleStatus.PENDING.getValue())
                .attempts(0)
                .build();
    }

    static ScrapedArticle toScrapedArticle(NewsRawArticle row) {
        return ScrapedArticle.builder()
                .sourceId(row.getSourceId())
                .sourceUrl(row.getSourceUrl())
                .sourceName(row.getSourceName())
                .title(row.getTitle())
                .content(row.getContent())
                .imageUrls(row.getImageUrls() == null ? List.of() : List.copyOf(row.getImageUrls()))
                .publishedAt(row.getPublishedAt())
                .build();
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
