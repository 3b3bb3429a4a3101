package com.whereq.orbit.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ClusterSpec {
    /**
     * Nodes to place together in one zone
     */
    int numNodes;
}
