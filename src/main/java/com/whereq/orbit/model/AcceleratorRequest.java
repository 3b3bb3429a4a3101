package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Accelerators requested per node, written as {@code count:TYPE} (e.g. {@code 2:A100_SXM})
 */
@Value
@Builder
@Jacksonized
public class AcceleratorRequest {
    /**
     * Accelerators per node
     */
    int count;

    /**
     * Internal accelerator name, see the accelerator catalog
     */
    String type;

    public static AcceleratorRequest none() {
        return new AcceleratorRequest(0, null);
    }

    @JsonIgnore
    public boolean isNone() {
        return count == 0 || type == null;
    }

    @Override
    public String toString() {
        return isNone() ? "none" : count + ":" + type;
    }
}
