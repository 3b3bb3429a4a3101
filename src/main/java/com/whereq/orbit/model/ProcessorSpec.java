package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Processor payload: a consumer of {@code stream} scaled by backpressure
 */
@Value
@Builder
@Jacksonized
public class ProcessorSpec {
    /**
     * Stream the processor consumes, also the source of its pressure metric
     */
    String stream;

    /**
     * Minimum number of workers, defaults to 1
     */
    Integer minReplicas;

    /**
     * Maximum number of workers, unbounded when absent
     */
    Integer maxReplicas;

    ScalePolicy scale;
}
