package com.whereq.orbit.autoscale;

import com.whereq.orbit.metrics.MetricSample;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-resource autoscaler bookkeeping. Guarded by its own monitor.
 */
class AutoscalerState {

    private final String resourceId;

    private final int windowCapacity;

    private final Deque<MetricSample> window = new ArrayDeque<>();

    private final Map<ScaleDirection, Instant> pendingSince = new EnumMap<>(ScaleDirection.class);

    private int currentTarget;

    private Instant lastScaleActionTime;

    AutoscalerState(String resourceId, int windowCapacity, int currentTarget) {
        this.resourceId = resourceId;
        this.windowCapacity = Math.max(1, windowCapacity);
        this.currentTarget = currentTarget;
    }

    /**
     * Append a sample to the bounded window
     *
     * @return false if the sample is not newer than the last one
     */
    boolean append(MetricSample sample) {
        MetricSample last = window.peekLast();
        if (last != null && !sample.getTimestamp().isAfter(last.getTimestamp())) {
            return false;
        }
        window.addLast(sample);
        while (window.size() > windowCapacity) {
            window.removeFirst();
        }
        return true;
    }

    /**
     * Start or stop tracking how long a direction's predicate has held
     */
    void track(ScaleDirection direction, boolean satisfied, Instant at) {
        if (satisfied) {
            pendingSince.putIfAbsent(direction, at);
        } else {
            pendingSince.remove(direction);
        }
    }

    Instant pendingSince(ScaleDirection direction) {
        return pendingSince.get(direction);
    }

    void fired(ScaleDirection direction, int newTarget, Instant at) {
        pendingSince.remove(direction);
        currentTarget = newTarget;
        lastScaleActionTime = at;
    }

    int getCurrentTarget() {
        return currentTarget;
    }

    void setCurrentTarget(int currentTarget) {
        this.currentTarget = currentTarget;
    }

    Instant getLastScaleActionTime() {
        return lastScaleActionTime;
    }

    AutoscalerSnapshot snapshot() {
        return AutoscalerSnapshot.builder()
            .resourceId(resourceId)
            .currentTarget(currentTarget)
            .windowSize(window.size())
            .lastSample(window.peekLast())
            .lastScaleActionTime(lastScaleActionTime)
            .pendingSince(Map.copyOf(pendingSince))
            .build();
    }
}
