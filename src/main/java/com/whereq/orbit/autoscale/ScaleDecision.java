package com.whereq.orbit.autoscale;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one autoscaler evaluation
 */
@Value
@Builder
public class ScaleDecision {
    String resourceId;

    /**
     * Rule that fired, null when the target stays put
     */
    ScaleDirection direction;

    int previousTarget;

    int target;

    String reason;

    Instant evaluatedAt;

    public boolean isAction() {
        return direction != null && target != previousTarget;
    }

    static ScaleDecision none(String resourceId, int target, String reason, Instant evaluatedAt) {
        return ScaleDecision.builder()
            .resourceId(resourceId)
            .previousTarget(target)
            .target(target)
            .reason(reason)
            .evaluatedAt(evaluatedAt)
            .build();
    }
}
