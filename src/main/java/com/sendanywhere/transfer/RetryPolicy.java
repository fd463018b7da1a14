package com.sendanywhere.transfer;

import java.time.Duration;

/**
 * Per-chunk retry budget with linear backoff: the wait after failed attempt
 * {@code n} is {@code baseDelay * n}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0: " + baseDelay);
        }
    }

    public Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(attempt);
    }
}
