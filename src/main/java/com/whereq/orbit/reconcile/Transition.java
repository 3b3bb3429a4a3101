package com.whereq.orbit.reconcile;

import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one reconciliation step of a resource
 */
@Value
@Builder(toBuilder = true)
public class Transition {

    /**
     * The resource as read before the step
     */
    Resource resource;

    /**
     * Status to write, null when the resource is already where it should be
     */
    ResourceStatus status;

    /**
     * Instances created during the step; never lost, even if the status write has to be rebased
     */
    @Builder.Default
    List<Instance> created = List.of();

    /**
     * Look at the resource again after this delay, null when only an event should wake it
     */
    Duration requeueAfter;

    /**
     * Side effects to run once the status is committed
     */
    @Builder.Default
    List<Runnable> afterCommit = List.of();

    /**
     * The resource as stored after the step
     */
    Resource committed;

    public boolean isChanged() {
        return status != null;
    }

    static Transition unchanged(Resource resource) {
        return Transition.builder().resource(resource).committed(resource).build();
    }

    static Transition unchanged(Resource resource, Duration requeueAfter) {
        return Transition.builder().resource(resource).committed(resource).requeueAfter(requeueAfter).build();
    }
}
