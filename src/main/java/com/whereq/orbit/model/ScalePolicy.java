package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Scale rules of an elastic resource.
 * <p>
 * {@code up} fires when the metric is at or above its threshold, {@code down} and
 * {@code zero} when it is at or below theirs. {@code zero} defaults to a threshold of 0.
 * </p>
 */
@Value
@Builder
@Jacksonized
public class ScalePolicy {
    ScaleRule up;
    ScaleRule down;
    ScaleRule zero;

    @JsonIgnore
    public boolean isEmpty() {
        return up == null && down == null && zero == null;
    }
}
