package com.whereq.orbit.model;

/**
 * Lifecycle of a single provisioned instance
 */
public enum InstancePhase {
    PROVISIONING,
    RUNNING,
    DRAINING,
    TERMINATED,
    FAILED;

    public boolean isActive() {
        return this != TERMINATED && this != FAILED;
    }
}
