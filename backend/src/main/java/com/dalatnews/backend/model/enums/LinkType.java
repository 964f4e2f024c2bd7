package com.dalatnews.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum LinkType {
    EVENT("event"),
    VENUE("venue"),
    LOCATION("location");

    private final String value;

    LinkType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup for values coming back from the text-generation service.
     * Anything unrecognised is treated as a location.
     */
    public static LinkType fromValue(String value) {
        if (value == null) return LOCATION;
        for (LinkType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return LOCATION;
    }
}
