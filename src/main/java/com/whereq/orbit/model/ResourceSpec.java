package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Desired state of a resource, immutable per generation.
 * <p>
 * Shared container template fields plus exactly one kind payload ({@code processor},
 * {@code service} or {@code cluster}); containers carry no payload.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ResourceSpec {
    /**
     * Container image
     */
    String image;

    String command;

    String args;

    @Builder.Default
    Map<String, String> env = Map.of();

    /**
     * Accelerator options in order of preference, each {@code count:TYPE}
     */
    @Builder.Default
    List<String> accelerators = List.of();

    /**
     * Explicit platform, overrides {@code platforms}
     */
    String platform;

    /**
     * Platform preference list
     */
    @Builder.Default
    List<String> platforms = List.of();

    /**
     * Named FIFO queue, at most one holder at a time
     */
    String queue;

    @Builder.Default
    RestartPolicy restart = RestartPolicy.NEVER;

    /**
     * Containers only: how long the container may run before it is terminated and
     * failed, e.g. "2h". Counted from the first time it reached RUNNING.
     */
    String timeout;

    /**
     * Secret names handed to the placement backend as-is
     */
    @Builder.Default
    List<String> secretRefs = List.of();

    /**
     * Address the network mesh should give the instances, handed to the backend as-is
     */
    String meshAddress;

    /**
     * Overrides the configured retry policy
     */
    RetryPolicy retryPolicy;

    ProcessorSpec processor;

    ServiceSpec service;

    ClusterSpec cluster;

    /**
     * Stable digest of the placement-relevant template fields. Instances created from a
     * template with another digest have to be replaced.
     */
    public String templateFingerprint() {
        int hash = Objects.hash(image, command, args, env, accelerators, platform, platforms,
            secretRefs, meshAddress, clusterNodes());
        return Integer.toHexString(hash);
    }

    private int clusterNodes() {
        return cluster == null ? 0 : cluster.getNumNodes();
    }
}
