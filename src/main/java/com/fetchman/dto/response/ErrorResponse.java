package com.fetchman.dto.response;

/**
 * The structured body of every failed API call. Raw stack traces and transport exceptions are
 * never exposed to the caller.
 *
 * @param error   A short, stable summary of what failed.
 * @param message Details for the user.
 */
public record ErrorResponse(String error, String message) {
}
