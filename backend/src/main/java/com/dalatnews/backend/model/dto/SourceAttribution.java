package com.dalatnews.backend.model.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SourceAttribution {
    String url;
    String title;
    String publisher;
    String publishedAt;
}
