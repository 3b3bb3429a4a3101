package com.whereq.orbit.metrics;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One observation of a scaling metric
 */
@Value
@Builder
@Jacksonized
public class MetricSample {
    Instant timestamp;

    /**
     * Pending messages (pressure) or milliseconds (latency)
     */
    double value;

    public static MetricSample of(Instant timestamp, double value) {
        return new MetricSample(timestamp, value);
    }
}
