package com.whereq.orbit.model;

/**
 * What to do with an instance that turns unhealthy after it was running
 */
public enum RestartPolicy {
    /**
     * Replace the instance
     */
    ALWAYS,

    /**
     * Fail the resource
     */
    NEVER
}
