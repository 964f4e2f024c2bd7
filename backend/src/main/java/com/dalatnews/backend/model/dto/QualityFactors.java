package com.dalatnews.backend.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class QualityFactors {
    int sourceCount;
    boolean hasDates;
    boolean hasNamedSources;
    boolean hasImages;
    int contentLength;
    double dalatRelevance;
}
