package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Filter for listing resources; null fields match everything
 */
@Value
@Builder
public class ResourceFilter {
    String owner;
    String namespace;
    ResourceKind kind;
    ResourcePhase phase;
    String queue;
    Boolean terminal;

    public static ResourceFilter all() {
        return ResourceFilter.builder().build();
    }

    public static ResourceFilter active() {
        return ResourceFilter.builder().terminal(false).build();
    }

    public boolean matches(Resource resource) {
        return (owner == null || owner.equals(resource.getOwner()))
            && (namespace == null || namespace.equals(resource.getNamespace()))
            && (kind == null || kind == resource.getKind())
            && (phase == null || phase == resource.phase())
            && (queue == null || queue.equals(resource.getSpec().getQueue()))
            && (terminal == null || terminal == resource.phase().isTerminal());
    }
}
