package com.fetchman.controller;

import com.fetchman.dto.response.ErrorResponse;
import com.fetchman.exception.ConfigurationException;
import com.fetchman.exception.ExecutionFailedException;
import com.fetchman.exception.FetchmanException;
import com.fetchman.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Translates exceptions into the {@code {error, message}} body. Nothing below this layer ever
 * reaches the client as a stack trace.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ExecutionFailedException.class)
    public ResponseEntity<ErrorResponse> handleExecutionFailed(ExecutionFailedException e) {
        HttpStatus status = e.isTimedOut() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(new ErrorResponse("Failed to execute request", e.getMessage()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getDefaultMessage() != null ? f.getDefaultMessage() : f.getField() + " is invalid")
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", e.getReason()));
    }

    /**
     * Framework-level rejections such as 404, 405 or 415 keep their status and headers.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        HttpStatus known = HttpStatus.resolve(status.value());
        String error = known != null ? known.getReasonPhrase() : "Request failed";
        String message = e.getReason() != null ? e.getReason() : error;
        return ResponseEntity.status(status).headers(e.getHeaders()).body(new ErrorResponse(error, message));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.error("Encryption is not configured: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Encryption is not configured", e.getMessage()));
    }

    @ExceptionHandler(FetchmanException.class)
    public ResponseEntity<ErrorResponse> handleFetchman(FetchmanException e) {
        log.error("Request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal error", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal error", "Unexpected error while processing the request"));
    }
}
