package com.fetchman.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the response body was classified for transport back to the caller.
 */
public enum BodyType {
    JSON("json"),
    TEXT("text"),
    HTML("html"),
    IMAGE("image"),
    BINARY("binary");

    private final String wireName;

    BodyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
