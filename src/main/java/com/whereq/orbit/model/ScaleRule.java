package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One scale rule: the metric has to stay past {@code threshold} for {@code duration}
 */
@Value
@Builder
@Jacksonized
public class ScaleRule {
    /**
     * Metric threshold (pressure in pending messages, latency in milliseconds)
     */
    Double threshold;

    /**
     * Dwell duration, e.g. "10s", "10m" or ISO-8601 "PT10M". Empty means fire on first sample
     */
    String duration;
}
