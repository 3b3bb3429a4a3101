package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Desired spec as written by the management API, before the store assigns identity
 */
@Value
@Builder
public class ResourceDraft {
    String name;
    String namespace;
    String owner;
    ResourceKind kind;
    ResourceSpec spec;
}
