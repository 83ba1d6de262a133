package com.apicache.web;

import com.apicache.exception.UpstreamBodyReadException;
import com.apicache.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps forwarding failures to fixed plain-text responses. Internal error details are logged,
 * never returned.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String UPSTREAM_UNAVAILABLE = "upstream service unavailable";
    static final String BODY_READ_FAILED = "failed to read upstream response";
    static final String INTERNAL_ERROR = "internal server error";

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<String> handleUpstreamUnavailable(UpstreamUnavailableException e) {
        log.error("Failed to forward request: attempts={}, error={}", e.getAttempts(), String.valueOf(e.getCause()));
        return plainText(HttpStatus.BAD_GATEWAY, UPSTREAM_UNAVAILABLE);
    }

    @ExceptionHandler(UpstreamBodyReadException.class)
    public ResponseEntity<String> handleBodyRead(UpstreamBodyReadException e) {
        log.error("Failed to read upstream response body: {}", String.valueOf(e.getCause()));
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR, BODY_READ_FAILED);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        return plainText(e.getStatusCode(), e.getReason() != null ? e.getReason() : "");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("Unexpected error while proxying request", e);
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    private static ResponseEntity<String> plainText(HttpStatusCode status, String body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
