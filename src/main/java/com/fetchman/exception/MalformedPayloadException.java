package com.fetchman.exception;

/**
 * A stored ciphertext envelope does not have the {@code iv:ciphertext:tag} shape.
 */
public class MalformedPayloadException extends FetchmanException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
