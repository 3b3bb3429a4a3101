package com.whereq.orbit.model;

/**
 * Resource lifecycle states
 *
 * State transitions:
 * PENDING → QUEUED → SCHEDULING → PROVISIONING → RUNNING → DRAINING → TERMINATING → {TERMINATED, FAILED}
 * DRAINING → PENDING (template changed, resource not deleted)
 * SCHEDULING, PROVISIONING → TERMINATING (deleted while placement is in flight)
 */
public enum ResourcePhase {
    /**
     * Newly created or spec-updated, not yet evaluated
     */
    PENDING,

    /**
     * Waiting for admission to a named queue
     */
    QUEUED,

    /**
     * Admitted, waiting for placement
     */
    SCHEDULING,

    /**
     * Placement accepted, waiting for healthy instances
     */
    PROVISIONING,

    /**
     * All required instances healthy
     */
    RUNNING,

    /**
     * Instances are being drained before termination or replacement
     */
    DRAINING,

    /**
     * Deletion requested, terminating all instances
     */
    TERMINATING,

    /**
     * Cleanly deleted
     */
    TERMINATED,

    /**
     * Retries exhausted or spec rejected
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == TERMINATED || this == FAILED;
    }

    /**
     * Check if a resource in this phase holds its queue (when it names one)
     */
    public boolean holdsQueue() {
        return this == SCHEDULING || this == PROVISIONING || this == RUNNING
            || this == DRAINING || this == TERMINATING;
    }
}
