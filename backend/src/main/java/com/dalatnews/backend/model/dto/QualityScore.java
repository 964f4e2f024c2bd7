package com.dalatnews.backend.model.dto;

import com.dalatnews.backend.model.enums.PublishStatus;
import java.util.Map;
import lombok.Value;

@Value
public class QualityScore {
    double total;
    // Weighted contribution of every factor, keyed by factor name
    Map<String, Double> breakdown;
    PublishStatus suggestedStatus;
}
