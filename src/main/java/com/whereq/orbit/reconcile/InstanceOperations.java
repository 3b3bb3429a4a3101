package com.whereq.orbit.reconcile;

import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.InstancePhase;
import com.whereq.orbit.placement.PlacementBackend;
import com.whereq.orbit.placement.PlacementBackendRegistry;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend calls on individual instances: health, termination and draining
 */
@Slf4j
class InstanceOperations {

    private final PlacementBackendRegistry backendRegistry;

    private final Duration drainTimeout;

    private final Counter forcedDrainCounter;

    InstanceOperations(PlacementBackendRegistry backendRegistry, Duration drainTimeout, Counter forcedDrainCounter) {
        this.backendRegistry = backendRegistry;
        this.drainTimeout = drainTimeout;
        this.forcedDrainCounter = forcedDrainCounter;
    }

    /**
     * Health of every given instance, by instance id. A failed check counts as UNKNOWN,
     * an instance on a platform that is no longer configured as UNHEALTHY.
     */
    Mono<Map<String, HealthStatus>> health(List<Instance> instances) {
        return Flux.fromIterable(instances)
            .concatMap(instance -> health(instance).map(status -> Map.entry(instance.getInstanceId(), status)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    private Mono<HealthStatus> health(Instance instance) {
        Optional<PlacementBackend> backend = backendRegistry.get(instance.getPlatform());
        if (backend.isEmpty()) {
            log.warn("Instance {} runs on unknown platform {}", instance.getInstanceId(), instance.getPlatform());
            return Mono.just(HealthStatus.UNHEALTHY);
        }
        return backend.get().healthCheck(instance.getInstanceId())
            .defaultIfEmpty(HealthStatus.UNKNOWN)
            .onErrorResume(e -> {
                log.warn("Health check of instance {} failed: {}", instance.getInstanceId(), e.getMessage());
                return Mono.just(HealthStatus.UNKNOWN);
            });
    }

    /**
     * Terminate instances one by one
     *
     * @return the instances marked TERMINATED; errors with the first backend failure
     */
    Mono<List<Instance>> terminate(List<Instance> instances) {
        return Flux.fromIterable(instances)
            .concatMap(this::terminate)
            .collectList();
    }

    Mono<Instance> terminate(Instance instance) {
        Optional<PlacementBackend> backend = backendRegistry.get(instance.getPlatform());
        if (backend.isEmpty()) {
            log.warn("Instance {} runs on unknown platform {}, considering it gone",
                instance.getInstanceId(), instance.getPlatform());
            return Mono.just(instance.withPhase(InstancePhase.TERMINATED));
        }
        return backend.get().terminate(instance.getInstanceId())
            .then(Mono.fromCallable(() -> instance.withPhase(InstancePhase.TERMINATED)));
    }

    /**
     * Terminate draining instances that have no work left or have run out of drain time.
     * Failures leave the instance draining for the next pass.
     *
     * @return all instances, with finished drains marked TERMINATED
     */
    Mono<List<Instance>> advanceDrains(List<Instance> instances, Instant now) {
        return Flux.fromIterable(instances)
            .concatMap(instance -> instance.getPhase() == InstancePhase.DRAINING
                ? advanceDrain(instance, now)
                : Mono.just(instance))
            .collectList();
    }

    private Mono<Instance> advanceDrain(Instance instance, Instant now) {
        Instant started = instance.getDrainStartedAt() == null ? now : instance.getDrainStartedAt();
        boolean timedOut = !started.plus(drainTimeout).isAfter(now);

        Mono<Integer> inFlight = backendRegistry.get(instance.getPlatform())
            .map(backend -> backend.inFlight(instance.getInstanceId())
                .defaultIfEmpty(0)
                .onErrorResume(e -> {
                    log.debug("In-flight query of instance {} failed: {}", instance.getInstanceId(), e.getMessage());
                    return Mono.just(Integer.MAX_VALUE);
                }))
            .orElse(Mono.just(0));

        return inFlight.flatMap(count -> {
            if (count > 0 && !timedOut) {
                return Mono.just(instance);
            }
            if (count > 0) {
                forcedDrainCounter.increment();
                log.warn("Instance {} still has {} in-flight units after {}, terminating anyway",
                    instance.getInstanceId(), count == Integer.MAX_VALUE ? "unknown" : count, drainTimeout);
            }
            return terminate(instance)
                .onErrorResume(e -> {
                    log.warn("Failed to terminate drained instance {}: {}", instance.getInstanceId(), e.getMessage());
                    return Mono.just(instance);
                });
        });
    }

    /**
     * Replace instances in a list by id, keeping the list order
     */
    static List<Instance> merge(List<Instance> instances, List<Instance> updates) {
        Map<String, Instance> byId = new LinkedHashMap<>();
        for (Instance update : updates) {
            byId.put(update.getInstanceId(), update);
        }
        List<Instance> merged = new ArrayList<>(instances.size());
        for (Instance instance : instances) {
            merged.add(byId.getOrDefault(instance.getInstanceId(), instance));
        }
        return merged;
    }
}
