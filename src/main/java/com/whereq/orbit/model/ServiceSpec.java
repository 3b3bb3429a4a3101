package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Service payload: request-serving containers scaled by latency
 */
@Value
@Builder
@Jacksonized
public class ServiceSpec {
    /**
     * Minimum number of containers, defaults to 1. Zero allows scale-to-zero
     */
    Integer minContainers;

    /**
     * Maximum number of containers, unbounded when absent
     */
    Integer maxContainers;

    ScalePolicy scale;

    Integer port;
}
