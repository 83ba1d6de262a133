package com.apicache.exception;

import lombok.Getter;

/**
 * Upstream could not be reached after all attempts (transport-level failures only).
 * Surfaced to the client as 502.
 */
@Getter
public class UpstreamUnavailableException extends RuntimeException {

    private final int attempts;

    public UpstreamUnavailableException(int attempts, Throwable lastError) {
        super("all retry attempts failed after " + attempts + " attempt(s)", lastError);
        this.attempts = attempts;
    }
}
