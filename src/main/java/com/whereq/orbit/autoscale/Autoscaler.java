package com.whereq.orbit.autoscale;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.metrics.MetricFeed;
import com.whereq.orbit.metrics.MetricSample;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.model.ScaleRule;
import com.whereq.orbit.resource.DurationParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes target instance counts for processors and services from their scale rules.
 * <p>
 * A rule fires once its predicate has held for its whole dwell duration, measured on
 * sample timestamps. When several rules fire together ZERO wins over DOWN and DOWN over
 * UP. Targets move by a fixed step and never leave {@code [min, max]}; no two actions on
 * a resource happen within the minimum action interval.
 * </p>
 */
@Slf4j
@Service
public class Autoscaler {

    private final MetricFeed metricFeed;

    private final OrbitProperties.AutoscalerConfig config;

    private final Map<String, AutoscalerState> states = new ConcurrentHashMap<>();

    private final Map<ScaleDirection, Counter> decisionCounters = new EnumMap<>(ScaleDirection.class);

    private final Counter throttledCounter;

    @Autowired
    public Autoscaler(MetricFeed metricFeed, OrbitProperties properties, MeterRegistry meterRegistry) {
        this.metricFeed = metricFeed;
        this.config = properties.getAutoscaler();

        for (ScaleDirection direction : ScaleDirection.values()) {
            decisionCounters.put(direction, Counter.builder("orbit.autoscaler.decisions")
                .tag("action", direction.name().toLowerCase())
                .description("Scale actions taken")
                .register(meterRegistry));
        }

        throttledCounter = Counter.builder("orbit.autoscaler.throttled")
            .description("Fired rules held back by the minimum action interval")
            .register(meterRegistry);

        Gauge.builder("orbit.autoscaler.tracked", states::size)
            .description("Resources with autoscaler state")
            .register(meterRegistry);
    }

    /**
     * Evaluate a resource against its latest metric sample.
     * Resources that are not running elastic resources with a scale policy are skipped.
     *
     * @return Mono with the decision, empty when there was nothing to evaluate
     */
    public Mono<ScaleDecision> evaluate(Resource resource) {
        if (!isEvaluable(resource)) {
            return Mono.empty();
        }
        return metricFeed.sample(resource)
            .map(sample -> evaluate(resource, sample));
    }

    /**
     * Feed one sample into the resource's state and decide. An action only takes
     * effect on the state once passed to {@link #recordAction}.
     *
     * @param resource running elastic resource
     * @param sample latest metric sample
     * @return the decision, possibly a no-op
     */
    public ScaleDecision evaluate(Resource resource, MetricSample sample) {
        AutoscalerState state = states.computeIfAbsent(resource.getId(),
            id -> new AutoscalerState(id, config.getWindowSize(), resource.desiredInstances()));

        synchronized (state) {
            // The persisted target is the truth, re-clamped to the current bounds
            state.setCurrentTarget(resource.desiredInstances());
            Instant now = sample.getTimestamp();
            int current = state.getCurrentTarget();

            if (!state.append(sample)) {
                return ScaleDecision.none(resource.getId(), current, "Stale sample", now);
            }

            ScalePolicy policy = resource.scalePolicy();
            int min = resource.minInstances();
            int max = resource.maxInstances();
            double value = sample.getValue();

            state.track(ScaleDirection.UP, above(policy.getUp(), value), now);
            state.track(ScaleDirection.DOWN, below(policy.getDown(), value), now);
            state.track(ScaleDirection.ZERO, below(policy.getZero(), value), now);

            Optional<ScaleDirection> fired = firstFired(resource, state, policy, now, current, min, max);
            if (fired.isEmpty()) {
                return ScaleDecision.none(resource.getId(), current, "No rule fired", now);
            }

            ScaleDirection direction = fired.get();
            Instant lastAction = state.getLastScaleActionTime();
            if (lastAction != null && Duration.between(lastAction, now).compareTo(config.getMinActionInterval()) < 0) {
                throttledCounter.increment();
                log.debug("Resource {}: {} rule fired within {} of the last action, holding",
                    resource.getId(), direction, config.getMinActionInterval());
                return ScaleDecision.none(resource.getId(), current, "Throttled (too soon)", now);
            }

            int target = switch (direction) {
                case UP -> clamp(current + Math.max(1, config.getScaleUpStep()), min, max);
                case DOWN -> clamp(current - Math.max(1, config.getScaleDownStep()), min, max);
                case ZERO -> 0;
            };
            String reason = String.format("%s rule fired at %s=%.1f", direction, resource.metricSource(), value);
            log.debug("Resource {} proposes {} -> {}: {}", resource.getId(), current, target, reason);

            return ScaleDecision.builder()
                .resourceId(resource.getId())
                .direction(direction)
                .previousTarget(current)
                .target(target)
                .reason(reason)
                .evaluatedAt(now)
                .build();
        }
    }

    /**
     * Record an action whose target has been persisted. Starts the minimum action
     * interval and the next dwell of the rule that fired; a decision that never made
     * it to the store leaves the state as it was, so the rule fires again next tick.
     */
    public void recordAction(ScaleDecision decision) {
        if (!decision.isAction()) {
            return;
        }
        AutoscalerState state = states.get(decision.getResourceId());
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.fired(decision.getDirection(), decision.getTarget(), decision.getEvaluatedAt());
        }
        decisionCounters.get(decision.getDirection()).increment();
        log.info("Resource {} scaled {} -> {}: {}", decision.getResourceId(), decision.getPreviousTarget(),
            decision.getTarget(), decision.getReason());
    }

    /**
     * Drop the state of a resource that has left the system
     */
    public void discard(String resourceId) {
        if (states.remove(resourceId) != null) {
            log.debug("Discarded autoscaler state of resource {}", resourceId);
        }
    }

    public Optional<AutoscalerSnapshot> snapshot(String resourceId) {
        AutoscalerState state = states.get(resourceId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.snapshot());
        }
    }

    private boolean isEvaluable(Resource resource) {
        ScalePolicy policy = resource.scalePolicy();
        return resource.isElastic()
            && !resource.isDeletionRequested()
            && resource.phase() == ResourcePhase.RUNNING
            && policy != null
            && !policy.isEmpty();
    }

    private Optional<ScaleDirection> firstFired(Resource resource, AutoscalerState state, ScalePolicy policy,
                                                Instant now, int current, int min, int max) {
        if (min == 0 && current > 0 && dwelled(resource, state, ScaleDirection.ZERO, policy.getZero(), now)) {
            return Optional.of(ScaleDirection.ZERO);
        }
        if (current > min && dwelled(resource, state, ScaleDirection.DOWN, policy.getDown(), now)) {
            return Optional.of(ScaleDirection.DOWN);
        }
        if (current < max && dwelled(resource, state, ScaleDirection.UP, policy.getUp(), now)) {
            return Optional.of(ScaleDirection.UP);
        }
        return Optional.empty();
    }

    private boolean dwelled(Resource resource, AutoscalerState state, ScaleDirection direction,
                            ScaleRule rule, Instant now) {
        Instant since = state.pendingSince(direction);
        if (rule == null || since == null) {
            return false;
        }
        Duration dwell;
        try {
            dwell = DurationParser.parse(rule.getDuration());
        } catch (ResourceValidationException e) {
            log.warn("Resource {}: ignoring {} rule with invalid duration: {}",
                resource.getId(), direction, e.getMessage());
            return false;
        }
        return Duration.between(since, now).compareTo(dwell) >= 0;
    }

    private static boolean above(ScaleRule rule, double value) {
        return rule != null && rule.getThreshold() != null && value >= rule.getThreshold();
    }

    private static boolean below(ScaleRule rule, double value) {
        if (rule == null) {
            return false;
        }
        double threshold = rule.getThreshold() == null ? 0 : rule.getThreshold();
        return value <= threshold;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
