package com.whereq.orbit.scheduler;

import com.whereq.orbit.exception.NoCapacityException;
import com.whereq.orbit.exception.ProvisioningException;
import com.whereq.orbit.model.AcceleratorRequest;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceSpec;
import com.whereq.orbit.placement.PlacementBackend;
import com.whereq.orbit.placement.PlacementBackendRegistry;
import com.whereq.orbit.placement.ProvisionRequest;
import com.whereq.orbit.resource.AcceleratorCatalog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Chooses a platform, zone and accelerator option for new instances and provisions them.
 * <p>
 * Accelerator options are tried in the order the resource lists them, and for each option the
 * candidate platforms in preference order. All instances of one request must fit into a
 * single zone. The first candidate with room is asked to provision; a provisioning failure
 * there is reported as is, without trying the next candidate.
 * </p>
 */
@Slf4j
@Service
public class PlacementScheduler {

    private final PlacementBackendRegistry backendRegistry;

    private final AcceleratorCatalog acceleratorCatalog;

    private final Timer placementTimer;

    private final Counter noCapacityCounter;

    private final Counter provisioningFailureCounter;

    @Autowired
    public PlacementScheduler(PlacementBackendRegistry backendRegistry,
                              AcceleratorCatalog acceleratorCatalog,
                              MeterRegistry meterRegistry) {
        this.backendRegistry = backendRegistry;
        this.acceleratorCatalog = acceleratorCatalog;

        this.placementTimer = Timer.builder("orbit.scheduler.placement")
            .description("Time to place and provision instances")
            .register(meterRegistry);

        this.noCapacityCounter = Counter.builder("orbit.scheduler.no-capacity")
            .description("Placements rejected for lack of capacity")
            .register(meterRegistry);

        this.provisioningFailureCounter = Counter.builder("orbit.scheduler.provisioning-failures")
            .description("Placements whose provisioning call failed")
            .register(meterRegistry);
    }

    /**
     * Place instances of a resource anywhere its spec allows
     *
     * @param resource the resource
     * @param instanceCount number of instances to create, all in one zone
     * @return Mono with the decision; errors with ResourceValidationException,
     *         NoCapacityException or ProvisioningException
     */
    public Mono<PlacementDecision> place(Resource resource, int instanceCount) {
        return place(resource, instanceCount, null);
    }

    /**
     * Place instances next to an existing instance: same platform and zone.
     * Used to replace nodes of a cluster.
     *
     * @param anchor instance to co-locate with, null for no constraint
     */
    public Mono<PlacementDecision> place(Resource resource, int instanceCount, Instance anchor) {
        return Mono.defer(() -> {
            List<Attempt> attempts = attempts(resource, anchor);
            long start = System.nanoTime();

            return Flux.fromIterable(attempts)
                .concatMap(attempt -> accepts(attempt, instanceCount, anchor))
                .next()
                .switchIfEmpty(Mono.defer(() -> {
                    noCapacityCounter.increment();
                    return Mono.error(new NoCapacityException(String.format(
                        "No capacity for %d x %s on %s", instanceCount, describeOptions(attempts),
                        describePlatforms(attempts))));
                }))
                .flatMap(accepted -> provision(resource, instanceCount, accepted))
                .doOnSuccess(decision -> placementTimer.record(Duration.ofNanos(System.nanoTime() - start)));
        });
    }

    /**
     * (accelerator option, platform) pairs in the order they are tried
     */
    private List<Attempt> attempts(Resource resource, Instance anchor) {
        ResourceSpec spec = resource.getSpec();
        List<AcceleratorRequest> options = acceleratorCatalog.parseAll(spec.getAccelerators());

        List<Attempt> attempts = new ArrayList<>();
        for (AcceleratorRequest option : options) {
            String type = option.isNone() ? null : option.getType();
            if (anchor != null) {
                if (anchor.getAcceleratorAllocation() != null
                    && !option.toString().equals(anchor.getAcceleratorAllocation().toString())) {
                    continue;
                }
                backendRegistry.get(anchor.getPlatform())
                    .filter(backend -> backend.supports(type))
                    .ifPresent(backend -> attempts.add(new Attempt(option, backend)));
                continue;
            }
            for (PlacementBackend backend : candidates(spec, type)) {
                attempts.add(new Attempt(option, backend));
            }
        }
        return attempts;
    }

    private List<PlacementBackend> candidates(ResourceSpec spec, String acceleratorType) {
        if (spec.getPlatform() != null && !spec.getPlatform().isBlank()) {
            PlacementBackend explicit = backendRegistry.require(spec.getPlatform());
            return explicit.supports(acceleratorType) ? List.of(explicit) : List.of();
        }

        if (spec.getPlatforms() != null && !spec.getPlatforms().isEmpty()) {
            return spec.getPlatforms().stream()
                .map(backendRegistry::require)
                .filter(backend -> backend.supports(acceleratorType))
                .toList();
        }

        return backendRegistry.all().stream()
            .filter(backend -> backend.supports(acceleratorType))
            .toList();
    }

    private Mono<Accepted> accepts(Attempt attempt, int instanceCount, Instance anchor) {
        AcceleratorRequest option = attempt.option;
        String type = option.isNone() ? null : option.getType();
        long required = (long) Math.max(1, option.getCount()) * instanceCount;

        return attempt.backend.queryCapacity(type)
            .flatMap(report -> {
                if (anchor != null) {
                    Integer available = report.getAvailable().get(anchor.getZone());
                    return available != null && available >= required
                        ? Mono.just(new Accepted(attempt, anchor.getZone()))
                        : Mono.empty();
                }
                return Mono.justOrEmpty(report.zoneFor(required))
                    .map(zone -> new Accepted(attempt, zone));
            })
            .doOnNext(accepted -> log.debug("Platform {} zone {} accepts {} x {}",
                attempt.backend.platform(), accepted.zone, instanceCount, option))
            .onErrorResume(e -> {
                log.warn("Capacity query on {} for {} failed, skipping candidate: {}",
                    attempt.backend.platform(), option, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<PlacementDecision> provision(Resource resource, int instanceCount, Accepted accepted) {
        ResourceSpec spec = resource.getSpec();
        PlacementBackend backend = accepted.attempt.backend;
        AcceleratorRequest allocation = accepted.attempt.option;

        ProvisionRequest request = ProvisionRequest.builder()
            .resourceId(resource.getId())
            .resourceName(resource.displayName())
            .kind(resource.getKind())
            .image(spec.getImage())
            .command(spec.getCommand())
            .args(spec.getArgs())
            .env(spec.getEnv())
            .zone(accepted.zone)
            .allocation(allocation)
            .nodeCount(instanceCount)
            .secretRefs(spec.getSecretRefs())
            .meshAddress(spec.getMeshAddress())
            .build();

        log.info("Placing {} x {} of resource {} on {}/{}",
            instanceCount, allocation, resource.getId(), backend.platform(), accepted.zone);

        return backend.provision(request)
            .onErrorMap(e -> !(e instanceof ProvisioningException),
                e -> new ProvisioningException("Provisioning on " + backend.platform() + " failed: " + e.getMessage(), e))
            .doOnError(e -> provisioningFailureCounter.increment())
            .map(instances -> PlacementDecision.builder()
                .platform(backend.platform())
                .zone(accepted.zone)
                .allocation(allocation)
                .instances(List.copyOf(instances))
                .build());
    }

    private static String describeOptions(List<Attempt> attempts) {
        return attempts.stream()
            .map(a -> a.option.toString())
            .distinct()
            .collect(Collectors.joining(" | ", "[", "]"));
    }

    private static String describePlatforms(List<Attempt> attempts) {
        List<String> platforms = attempts.stream()
            .map(a -> a.backend.platform())
            .distinct()
            .toList();
        return platforms.isEmpty() ? "no supporting platform" : String.join(", ", platforms);
    }

    private static class Attempt {
        final AcceleratorRequest option;
        final PlacementBackend backend;

        Attempt(AcceleratorRequest option, PlacementBackend backend) {
            this.option = option;
            this.backend = backend;
        }
    }

    private static class Accepted {
        final Attempt attempt;
        final String zone;

        Accepted(Attempt attempt, String zone) {
            this.attempt = attempt;
            this.zone = zone;
        }
    }
}
