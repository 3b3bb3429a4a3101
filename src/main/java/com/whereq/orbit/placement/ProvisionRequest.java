package com.whereq.orbit.placement;

import com.whereq.orbit.model.AcceleratorRequest;
import com.whereq.orbit.model.ResourceKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Request to start instances of a resource in one zone of a platform
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProvisionRequest {
    String resourceId;

    /**
     * namespace/name of the owning resource
     */
    String resourceName;

    ResourceKind kind;

    String image;

    String command;

    String args;

    @Builder.Default
    Map<String, String> env = Map.of();

    String zone;

    /**
     * Accelerators per instance, internal naming
     */
    AcceleratorRequest allocation;

    /**
     * Accelerator name as the platform calls it
     */
    String platformAcceleratorType;

    /**
     * Number of instances to create
     */
    int nodeCount;

    /**
     * Opaque secret references, resolved by the platform
     */
    @Builder.Default
    List<String> secretRefs = List.of();

    /**
     * Opaque mesh address the instances should be reachable at
     */
    String meshAddress;
}
