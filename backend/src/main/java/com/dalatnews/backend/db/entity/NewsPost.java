package com.dalatnews.backend.db.entity;

import com.dalatnews.backend.model.dto.SourceAttribution;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "news_posts", indexes = {
        @Index(name = "idx_news_posts_slug", columnList = "slug", unique = true),
        @Index(name = "idx_news_posts_fingerprint", columnList = "content_fingerprint")
})
public class NewsPost {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "story_content", nullable = false, columnDefinition = "TEXT")
    private String storyContent;

    @Column(name = "technical_content", columnDefinition = "TEXT")
    private String technicalContent;

    @Column(name = "meta_description", columnDefinition = "TEXT")
    private String metaDescription;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "seo_keywords")
    private List<String> seoKeywords;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "news_tags")
    private List<String> newsTags;

    @Column(name = "news_topic")
    private String newsTopic;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_descriptions")
    private List<String> imageDescriptions;

    @Column(name = "cover_image_url", columnDefinition = "TEXT")
    private String coverImageUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "source_urls")
    private List<SourceAttribution> sourceUrls;

    // published, experimental or draft
    @Column(nullable = false)
    private String status;

    @Column(name = "quality_score")
    private Double qualityScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "quality_breakdown")
    private Map<String, Double> qualityBreakdown;

    @Column(name = "content_fingerprint", columnDefinition = "TEXT")
    private String contentFingerprint;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
