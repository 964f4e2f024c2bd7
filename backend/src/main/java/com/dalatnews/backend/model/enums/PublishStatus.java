package com.dalatnews.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PublishStatus {
    PUBLISHED("published"),
    EXPERIMENTAL("experimental"),
    DRAFT("draft");

    private final String value;

    PublishStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
