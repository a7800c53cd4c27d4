package com.fetchman.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A decrypted variable as shown by the management view.
 *
 * @param key      The variable name.
 * @param value    The plaintext, empty if decryption failed.
 * @param isSecret Whether the UI masks the value.
 * @param error    {@code decryption_failed} when the stored value could not be verified, otherwise absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableView(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("isSecret") boolean isSecret,
        @JsonProperty("error") String error) {

    public static final String DECRYPTION_FAILED = "decryption_failed";

    public static VariableView decrypted(String key, String value, boolean isSecret) {
        return new VariableView(key, value, isSecret, null);
    }

    public static VariableView undecryptable(String key, boolean isSecret) {
        return new VariableView(key, "", isSecret, DECRYPTION_FAILED);
    }
}
