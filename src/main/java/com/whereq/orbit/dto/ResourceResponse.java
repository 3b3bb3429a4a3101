package com.whereq.orbit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ResourceSpec;
import com.whereq.orbit.model.ResourceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Resource as reported by the management API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceResponse {
    private String id;

    private String name;

    private String namespace;

    private String owner;

    private ResourceKind kind;

    private ResourceSpec spec;

    private ResourcePhase phase;

    /**
     * Reason for the current phase
     */
    private String message;

    private Long generation;

    private Long observedGeneration;

    private Long resourceVersion;

    private List<Instance> instances;

    /**
     * Instance count the autoscaler currently asks for (elastic resources)
     */
    private Integer targetInstances;

    /**
     * 1-based position in the queue while waiting
     */
    private Integer queuePosition;

    private Integer retryCount;

    private Instant createdAt;

    private Instant lastTransitionTime;

    private Instant startedAt;

    private Boolean deletionRequested;

    /**
     * Error message (if the request failed)
     */
    private String errorMessage;

    public static ResourceResponse from(Resource resource) {
        ResourceStatus status = resource.getStatus();
        return ResourceResponse.builder()
            .id(resource.getId())
            .name(resource.getName())
            .namespace(resource.getNamespace())
            .owner(resource.getOwner())
            .kind(resource.getKind())
            .spec(resource.getSpec())
            .phase(status.getPhase())
            .message(status.getMessage())
            .generation(resource.getGeneration())
            .observedGeneration(status.getObservedGeneration())
            .resourceVersion(resource.getResourceVersion())
            .instances(status.getInstances())
            .targetInstances(resource.isElastic() ? resource.desiredInstances() : null)
            .queuePosition(status.getQueuePosition())
            .retryCount(status.getRetryCount())
            .createdAt(resource.getCreatedAt())
            .lastTransitionTime(status.getLastTransitionTime())
            .startedAt(status.getStartedAt())
            .deletionRequested(resource.isDeletionRequested())
            .build();
    }

    /**
     * Create error response
     */
    public static ResourceResponse error(String message) {
        return ResourceResponse.builder()
            .errorMessage(message)
            .build();
    }
}
