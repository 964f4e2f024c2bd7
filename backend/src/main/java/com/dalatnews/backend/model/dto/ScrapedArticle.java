package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized article as extracted from one source page. Never mutated after a scraper creates it.
 */
@Value
@Builder
public class ScrapedArticle {
    String sourceId;
    String sourceUrl;
    String sourceName;
    String title;
    String content;
    @Builder.Default
    List<String> imageUrls = List.of();
    // ISO-8601, null when the page carries no date
    String publishedAt;

    public boolean hasImages() {
        return imageUrls != null && !imageUrls.isEmpty();
    }
}
