package com.whereq.orbit.dto;

import com.whereq.orbit.model.MetricSource;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A scaling metric observation pushed by a processor or a service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricReport {

    /**
     * Pending messages (PRESSURE) or milliseconds (LATENCY)
     */
    @NotNull
    @PositiveOrZero
    private Double value;

    /**
     * Defaults to the metric the resource scales on
     */
    private MetricSource source;

    /**
     * Observation time, defaults to the time of receipt
     */
    private Instant timestamp;
}
