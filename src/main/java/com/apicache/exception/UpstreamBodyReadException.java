package com.apicache.exception;

/**
 * Reading the upstream response body failed after the status line was received.
 * Local fault, never retried, surfaced as 500.
 */
public class UpstreamBodyReadException extends RuntimeException {

    public UpstreamBodyReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
