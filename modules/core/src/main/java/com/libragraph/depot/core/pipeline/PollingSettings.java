package com.libragraph.depot.core.pipeline;

import com.libragraph.depot.core.ValidationException;

import java.time.Duration;

/**
 * How long to wait for the registry to finish hashing a binary.
 */
public record PollingSettings(Duration interval, int maxAttempts) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_ATTEMPTS = 30;

    public PollingSettings {
        if (interval == null || interval.isNegative()) {
            throw new ValidationException("Polling interval must not be negative, got: " + interval);
        }
        if (maxAttempts < 1) {
            throw new ValidationException("Polling needs at least one attempt, got: " + maxAttempts);
        }
    }

    public static PollingSettings defaults() {
        return new PollingSettings(DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS);
    }
}
