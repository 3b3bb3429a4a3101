package com.whereq.orbit.model;

/**
 * Health reported by a placement backend for one instance
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
