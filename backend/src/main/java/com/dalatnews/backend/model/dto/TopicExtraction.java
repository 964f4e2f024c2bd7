package com.dalatnews.backend.model.dto;

import java.util.List;
import lombok.Value;

/**
 * Keywords and scores the text-generation service returned for a single article.
 */
@Value
public class TopicExtraction {
    List<String> keywords;
    String topic;
    double dalatRelevance;
    double newsworthiness;
}
