package com.whereq.orbit.scheduler;

import com.whereq.orbit.model.AcceleratorRequest;
import com.whereq.orbit.model.Instance;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a successful placement: where the instances went and what they got
 */
@Value
@Builder
public class PlacementDecision {
    String platform;

    String zone;

    /**
     * Accelerator option that was satisfied, per instance
     */
    AcceleratorRequest allocation;

    List<Instance> instances;
}
