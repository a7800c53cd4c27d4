package com.fetchman.exception;

public class SubstitutionException extends FetchmanException {

    public SubstitutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
