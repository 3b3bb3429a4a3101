package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Reconciler-owned observed state of a resource
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ResourceStatus {
    ResourcePhase phase;

    /**
     * Instances in creation order
     */
    @Builder.Default
    List<Instance> instances = List.of();

    Instant lastTransitionTime;

    /**
     * When the resource first reached RUNNING; survives restarts, cleared by a retry after FAILED
     */
    Instant startedAt;

    /**
     * Consecutive transient failures since the last success
     */
    int retryCount;

    /**
     * Human-readable reason for the current phase
     */
    String message;

    /**
     * Spec generation last reconciled
     */
    long observedGeneration;

    /**
     * Desired instance count of an elastic resource, as last computed by the autoscaler
     */
    Integer targetInstances;

    /**
     * Earliest time of the next placement attempt after a transient failure
     */
    Instant nextAttemptAt;

    /**
     * Position among the waiters of the resource's queue, 1-based, null when not waiting
     */
    Integer queuePosition;

    public static ResourceStatus pending(Instant now) {
        return ResourceStatus.builder()
            .phase(ResourcePhase.PENDING)
            .lastTransitionTime(now)
            .message("Awaiting reconciliation")
            .build();
    }

    /**
     * Instances that are neither terminated nor failed
     */
    public List<Instance> activeInstances() {
        return instances.stream().filter(Instance::isActive).toList();
    }

    /**
     * Active instances that are not on their way out
     */
    public List<Instance> servingInstances() {
        return instances.stream()
            .filter(i -> i.getPhase() == InstancePhase.PROVISIONING || i.getPhase() == InstancePhase.RUNNING)
            .toList();
    }
}
