package com.fetchman.exception;

/**
 * Input rejected at the API boundary (unsupported method, blank or duplicate variable keys).
 */
public class InvalidRequestException extends FetchmanException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
