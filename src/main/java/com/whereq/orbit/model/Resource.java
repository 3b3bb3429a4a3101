package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A managed orchestration object with desired spec and reconciled status
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Resource {
    String id;

    String name;

    String namespace;

    /**
     * Tenant owning the resource; (owner, namespace, name) is unique
     */
    String owner;

    ResourceKind kind;

    ResourceSpec spec;

    ResourceStatus status;

    /**
     * Spec version, bumped on every spec write
     */
    long generation;

    /**
     * Record version, bumped on every write; guards status updates
     */
    long resourceVersion;

    Instant createdAt;

    boolean deletionRequested;

    public String displayName() {
        return namespace + "/" + name;
    }

    public ResourcePhase phase() {
        return status.getPhase();
    }

    public boolean hasQueue() {
        return spec.getQueue() != null && !spec.getQueue().isBlank();
    }

    @JsonIgnore
    public boolean isElastic() {
        return kind.isElastic();
    }

    public MetricSource metricSource() {
        return kind == ResourceKind.PROCESSOR ? MetricSource.PRESSURE : MetricSource.LATENCY;
    }

    public ScalePolicy scalePolicy() {
        return switch (kind) {
            case PROCESSOR -> spec.getProcessor() == null ? null : spec.getProcessor().getScale();
            case SERVICE -> spec.getService() == null ? null : spec.getService().getScale();
            default -> null;
        };
    }

    /**
     * Lower instance bound of an elastic resource
     */
    public int minInstances() {
        Integer min = switch (kind) {
            case PROCESSOR -> spec.getProcessor() == null ? null : spec.getProcessor().getMinReplicas();
            case SERVICE -> spec.getService() == null ? null : spec.getService().getMinContainers();
            default -> null;
        };
        return min == null ? 1 : Math.max(0, min);
    }

    /**
     * Upper instance bound of an elastic resource
     */
    public int maxInstances() {
        Integer max = switch (kind) {
            case PROCESSOR -> spec.getProcessor() == null ? null : spec.getProcessor().getMaxReplicas();
            case SERVICE -> spec.getService() == null ? null : spec.getService().getMaxContainers();
            default -> null;
        };
        return max == null ? Integer.MAX_VALUE : Math.max(minInstances(), max);
    }

    /**
     * Number of instances the resource should have right now.
     * Elastic resources follow the persisted autoscaler target, starting at
     * {@code max(min, 1)} so that a fresh service has something to measure.
     */
    public int desiredInstances() {
        return switch (kind) {
            case CONTAINER -> 1;
            case CLUSTER -> spec.getCluster() == null ? 1 : spec.getCluster().getNumNodes();
            case PROCESSOR, SERVICE -> {
                Integer target = status.getTargetInstances();
                if (target == null) {
                    yield Math.min(maxInstances(), Math.max(minInstances(), 1));
                }
                yield Math.max(minInstances(), Math.min(maxInstances(), target));
            }
        };
    }

    @JsonIgnore
    public boolean isSpecObserved() {
        return status.getObservedGeneration() >= generation;
    }
}
