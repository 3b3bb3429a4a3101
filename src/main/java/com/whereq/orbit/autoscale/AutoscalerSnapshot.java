package com.whereq.orbit.autoscale;

import com.whereq.orbit.metrics.MetricSample;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a resource's autoscaler state
 */
@Value
@Builder
public class AutoscalerSnapshot {
    String resourceId;
    int currentTarget;
    int windowSize;
    MetricSample lastSample;
    Instant lastScaleActionTime;
    Map<ScaleDirection, Instant> pendingSince;
}
