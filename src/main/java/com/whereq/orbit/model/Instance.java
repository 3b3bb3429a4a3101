package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One provisioned unit (VM or container) owned by exactly one resource
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Instance {
    String instanceId;

    String platform;

    /**
     * Network-proximate grouping (region/zone) the instance was placed in
     */
    String zone;

    AcceleratorRequest acceleratorAllocation;

    String nodeAddress;

    InstancePhase phase;

    Instant createdAt;

    /**
     * When the instance entered DRAINING, null otherwise
     */
    Instant drainStartedAt;

    /**
     * Fingerprint of the spec template the instance was created from
     */
    String templateHash;

    @JsonIgnore
    public boolean isActive() {
        return phase != null && phase.isActive();
    }

    public Instance withPhase(InstancePhase newPhase) {
        return toBuilder().phase(newPhase).build();
    }

    public Instance draining(Instant now) {
        return toBuilder().phase(InstancePhase.DRAINING).drainStartedAt(now).build();
    }
}
