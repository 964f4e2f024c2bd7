package com.dalatnews.backend.model.dto;

import lombok.Builder;
import lombok.Value;

/**
 * The unit handed to persistence: synthesized content, its score and the link-rewritten bodies.
 */
@Value
@Builder
public class SynthesizedNewsArticle {
    ArticleCluster cluster;
    NewsContentOutput content;
    QualityScore quality;
    String linkedStoryContent;
    String linkedTechnicalContent;
}
