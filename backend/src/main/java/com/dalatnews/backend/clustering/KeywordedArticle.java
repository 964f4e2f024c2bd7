package com.dalatnews.backend.clustering;

import com.dalatnews.backend.model.dto.ScrapedArticle;
import com.dalatnews.backend.model.dto.TopicExtraction;
import java.util.List;
import lombok.Value;

/**
 * An article that passed keyword extraction and the relevance gate.
 */
@Value
public class KeywordedArticle {
    ScrapedArticle article;
    List<String> keywords;
    String fingerprint;
    String topic;
    double relevance;
    double newsworthiness;

    public static KeywordedArticle of(ScrapedArticle article, TopicExtraction extraction) {
        return new KeywordedArticle(article, extraction.getKeywords(), TopicFingerprint.of(extraction.getKeywords()),
                extraction.getTopic(), extraction.getDalatRelevance(), extraction.getNewsworthiness());
    }
}
