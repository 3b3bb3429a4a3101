package com.whereq.orbit.model;

/**
 * Kind tag selecting the variant-specific payload of a {@link ResourceSpec}.
 */
public enum ResourceKind {
    /**
     * Single container, one instance
     */
    CONTAINER,

    /**
     * Stream consumer scaled by backpressure on its stream
     */
    PROCESSOR,

    /**
     * Request-serving containers scaled by observed latency
     */
    SERVICE,

    /**
     * Fixed number of co-located nodes
     */
    CLUSTER;

    /**
     * Check if the autoscaler manages the instance count of this kind
     */
    public boolean isElastic() {
        return this == PROCESSOR || this == SERVICE;
    }
}
