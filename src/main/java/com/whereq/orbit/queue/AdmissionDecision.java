package com.whereq.orbit.queue;

/**
 * Admission decision
 */
public enum AdmissionDecision {
    /**
     * Resource holds the queue (or names no queue) and may be scheduled
     */
    ADMITTED,

    /**
     * Resource waits behind the current holder
     */
    WAITING
}
