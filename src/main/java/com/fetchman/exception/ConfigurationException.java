package com.fetchman.exception;

/**
 * Raised when the encryption secret is missing or violates the configured policy.
 * Fatal to every operation that needs the codec.
 */
public class ConfigurationException extends FetchmanException {

    public ConfigurationException(String message) {
        super(message);
    }
}
