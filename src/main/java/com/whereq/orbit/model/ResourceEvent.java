package com.whereq.orbit.model;

import lombok.Value;

/**
 * Store write notification, used to wake the reconciliation loop
 */
@Value
public class ResourceEvent {
    String resourceId;
    Type type;
    long resourceVersion;

    public enum Type {
        CREATED,
        SPEC_UPDATED,
        STATUS_UPDATED,
        DELETED
    }
}
