package com.fetchman.exception;

/**
 * The GCM authentication tag of an envelope did not verify: the value was tampered with,
 * truncated, or encrypted under a different key.
 */
public class PayloadAuthenticationException extends FetchmanException {

    public PayloadAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
