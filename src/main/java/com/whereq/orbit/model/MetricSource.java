package com.whereq.orbit.model;

/**
 * Metric driving an autoscaled resource
 */
public enum MetricSource {
    /**
     * Queue depth / consumer lag on the processor's stream
     */
    PRESSURE,

    /**
     * Observed request latency of a service, in milliseconds
     */
    LATENCY
}
