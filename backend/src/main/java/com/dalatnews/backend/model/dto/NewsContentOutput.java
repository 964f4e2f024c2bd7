package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The article synthesized for one cluster, as returned by the content processor.
 */
@Value
@Builder(toBuilder = true)
public class NewsContentOutput {
    String title;
    String storyContent;
    String technicalContent;
    String metaDescription;
    @Builder.Default
    List<String> seoKeywords = List.of();
    String suggestedSlug;
    @Builder.Default
    List<String> newsTags = List.of();
    String newsTopic;
    // Prompts for a generated cover when no source image is usable
    @Builder.Default
    List<String> imageDescriptions = List.of();
    @Builder.Default
    List<SourceAttribution> sourceUrls = List.of();
    // Suggested by the model, applied before dictionary links
    @Builder.Default
    List<InternalLink> internalLinks = List.of();
    QualityFactors qualityFactors;
}
