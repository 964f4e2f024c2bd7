package com.dalatnews.backend.db.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One scraped article as remembered across runs. The source URL is unique, so an article is
 * ingested once however often its listing page is scraped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "news_raw_articles", indexes = {
        @Index(name = "idx_news_raw_articles_status", columnList = "status"),
        @Index(name = "idx_news_raw_articles_scraped", columnList = "scraped_at")
})
public class NewsRawArticle {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(name = "source_url", nullable = false, unique = true, columnDefinition = "TEXT")
    private String sourceUrl;

    @Column(name = "source_name", nullable = false)
    private String sourceName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_urls")
    private List<String> imageUrls;

    // As extracted from the page, ISO-8601 when present
    @Column(name = "published_at")
    private String publishedAt;

    // pending, processing, processed, skipped or error
    @Column(nullable = false)
    private String status;

    // Processing runs that picked this article up
    @Column(nullable = false)
    private int attempts;

    @Column(name = "topic_fingerprint", columnDefinition = "TEXT")
    private String topicFingerprint;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topic_keywords")
    private List<String> topicKeywords;

    @Column(name = "cluster_id")
    private String clusterId;

    @Column(name = "news_post_id")
    private UUID newsPostId;

    @CreationTimestamp
    @Column(name = "scraped_at")
    private OffsetDateTime scrapedAt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
}
