package com.dalatnews.backend.post;

import com.dalatnews.backend.db.entity.NewsPost;
import com.dalatnews.backend.db.repository.NewsPostRepository;
import com.dalatnews.backend.model.dto.ArticleCluster;
import com.dalatnews.backend.model.dto.NewsContentOutput;
import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.SynthesizedNewsArticle;
import com.dalatnews.backend.model.enums.PublishStatus;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class NewsPostService {

    static final String DEFAULT_SLUG = "dalat-news";

    private final NewsPostRepository newsPostRepository;

    /**
     * The post already created for a story with this fingerprint, if any.
     */
    public Optional<NewsPost> findByFingerprint(String fingerprint) {
        return newsPostRepository.findFirstByContentFingerprint(fingerprint);
    }

    @Transactional
    public NewsPost save(SynthesizedNewsArticle article) {
        ArticleCluster cluster = article.getCluster();
        NewsContentOutput content = article.getContent();
        PublishStatus status = article.getQuality().getSuggestedStatus();

        NewsPost post = NewsPost.builder()
                .slug(uniqueSlug(content.getSuggestedSlug()))
                .title(content.getTitle())
                .storyContent(article.getLinkedStoryContent())
                .technicalContent(article.getLinkedTechnicalContent())
                .metaDescription(content.getMetaDescription())
                .seoKeywords(content.getSeoKeywords())
                .newsTags(content.getNewsTags())
                .newsTopic(content.getNewsTopic())
                .imageDescriptions(content.getImageDescriptions())
                .coverImageUrl(cluster.getArticles().stream()
                        .filter(ScrapedArticle::hasImages)
                        .map(a -> a.getImageUrls().get(0))
                        .findFirst()
                        .orElse(null))
                .sourceUrls(content.getSourceUrls())
                .status(status.getValue())
                .qualityScore(article.getQuality().getTotal())
                .qualityBreakdown(article.getQuality().getBreakdown())
                .contentFingerprint(cluster.getTopicFingerprint())
                .publishedAt(status == PublishStatus.PUBLISHED ? OffsetDateTime.now(ZoneOffset.UTC) : null)
                .build();

        NewsPost saved = newsPostRepository.save(post);
        log.info("Saved news post {} ({}, {})", saved.getSlug(), status.getValue(), article.getQuality().getTotal());
        return saved;
    }

    /**
     * The suggested slug, or a base-36 timestamp suffixed variant when it is taken.
     */
    String uniqueSlug(String suggestedSlug) {
        String slug = suggestedSlug == null || suggestedSlug.isBlank() ? DEFAULT_SLUG : suggestedSlug.trim();
        if (newsPostRepository.existsBySlug(slug)) {
            slug = slug + "-" + Long.toString(System.currentTimeMillis(), 36);
        }
        return slug;
    }
}
