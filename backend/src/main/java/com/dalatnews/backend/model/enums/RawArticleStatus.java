package com.dalatnews.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a scraped article in the ingestion ledger.
 */
public enum RawArticleStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    SKIPPED("skipped"),
    ERROR("error");

    private final String value;

    RawArticleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
