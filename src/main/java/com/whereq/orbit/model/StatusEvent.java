package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Append-only record of a status write, in causal order per resource
 */
@Value
@Builder
@Jacksonized
public class StatusEvent {
    String resourceId;
    long sequence;
    ResourcePhase phase;
    String message;
    int instanceCount;
    long resourceVersion;
    Instant timestamp;
}
