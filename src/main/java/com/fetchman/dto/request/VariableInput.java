package com.fetchman.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A plaintext variable submitted for storage.
 */
public record VariableInput(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("isSecret") boolean isSecret) {
}
