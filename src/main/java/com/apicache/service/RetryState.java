package com.apicache.service;

import lombok.Getter;

import java.time.Duration;

/**
 * Per-request retry bookkeeping: attempts made, the backoff to sleep before the next attempt,
 * and the last failure. Confined to one request and discarded when it completes.
 */
@Getter
public class RetryState {

    private final int maxAttempts;
    private final Duration maxBackoff;
    private final double multiplier;

    private int attempt;
    private Duration backoff;
    private Throwable lastError;

    public RetryState(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
        this.maxAttempts = maxAttempts;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
        this.backoff = cap(initialBackoff);
    }

    /**
     * Count an attempt that is about to be made.
     */
    public void recordAttempt() {
        attempt++;
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    /**
     * Record a failed attempt and move to the next backoff.
     *
     * @param error failure that triggered the retry
     * @return how long to wait before the next attempt
     */
    public Duration advance(Throwable error) {
        this.lastError = error;
        Duration current = backoff;
        backoff = cap(Duration.ofNanos((long) (current.toNanos() * multiplier)));
        return current;
    }

    private Duration cap(Duration value) {
        return value.compareTo(maxBackoff) > 0 ? maxBackoff : value;
    }
}
