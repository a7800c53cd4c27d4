package com.fetchman.exception;

/**
 * Base runtime exception for errors raised by the Fetchman execution engine.
 * <p>
 * The engine distinguishes failures that are local to one variable or one substitution step
 * (absorbed and logged) from failures of the outbound call itself (surfaced to the caller).
 * Each subclass marks one of those categories so callers can decide where to stop propagation.
 */
public class FetchmanException extends RuntimeException {

    /**
     * Constructs a new FetchmanException with the specified detail message.
     *
     * @param message The detail message.
     */
    public FetchmanException(String message) {
        super(message);
    }

    /**
     * Constructs a new FetchmanException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public FetchmanException(String message, Throwable cause) {
        super(message, cause);
    }
}
