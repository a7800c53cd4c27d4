package com.fetchman.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BodyEncoding {
    UTF8("utf8"),
    BASE64("base64");

    private final String wireName;

    BodyEncoding(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
