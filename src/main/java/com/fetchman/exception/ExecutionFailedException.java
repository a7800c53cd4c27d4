package com.fetchman.exception;

import lombok.Getter;

/**
 * The outbound HTTP call could not produce a response: DNS, connect, TLS, timeout,
 * an unreadable URL, or a response body over the in-memory limit.
 * <p>
 * One user-initiated execution maps to exactly one attempt, so this is never retried.
 */
@Getter
public class ExecutionFailedException extends FetchmanException {

    private final boolean timedOut;

    public ExecutionFailedException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ExecutionFailedException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }
}
