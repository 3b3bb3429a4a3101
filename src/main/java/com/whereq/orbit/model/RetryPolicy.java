package com.whereq.orbit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry policy for transient placement failures
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Maximum number of retry attempts
     */
    @Builder.Default
    private int maxRetries = 3;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 1000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Check if a resource that has failed {@code failures} times in a row is out of budget
     */
    public boolean isExhausted(int failures) {
        return failures > maxRetries;
    }

    /**
     * Exponential backoff before the next attempt, {@code retryCount} being the failures so far
     */
    public Duration backoff(int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        double backoff = initialIntervalMs * Math.pow(backoffMultiplier, exponent);
        return Duration.ofMillis((long) Math.min(backoff, maxIntervalMs));
    }
}
