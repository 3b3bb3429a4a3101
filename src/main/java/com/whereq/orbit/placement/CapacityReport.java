package com.whereq.orbit.placement;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;

/**
 * Available units of one accelerator type on a platform, per zone
 */
@Value
@Builder
@Jacksonized
public class CapacityReport {

    /**
     * Key used for CPU-only capacity, counted in instance slots
     */
    public static final String CPU = "CPU";

    String platform;

    String acceleratorType;

    /**
     * Zone to available units, in the platform's zone order
     */
    @Builder.Default
    Map<String, Integer> available = Map.of();

    /**
     * First zone able to hold all required units at once
     *
     * @param required accelerators (or instance slots) needed in a single zone
     */
    public Optional<String> zoneFor(long required) {
        return available.entrySet().stream()
            .filter(e -> e.getValue() != null && e.getValue() >= required)
            .map(Map.Entry::getKey)
            .findFirst();
    }

    public int total() {
        return available.values().stream().mapToInt(v -> v == null ? 0 : v).sum();
    }
}
