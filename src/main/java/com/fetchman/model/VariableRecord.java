package com.fetchman.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A workspace variable as it is persisted: the value is always a ciphertext envelope.
 *
 * @param key      The identifier used in {@code {{key}}} placeholders, unique within a workspace.
 * @param value    The encrypted value in {@code iv:ciphertext:tag} form.
 * @param isSecret Whether the UI should mask the value. Has no effect on encryption: every value is encrypted.
 */
public record VariableRecord(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("isSecret") boolean isSecret) {
}
