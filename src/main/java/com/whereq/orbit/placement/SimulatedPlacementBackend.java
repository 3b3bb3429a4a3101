package com.whereq.orbit.placement;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ProvisioningException;
import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.InstancePhase;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-process platform with a fixed pool of capacity per zone.
 * Provisioning takes units out of the pool, termination puts them back.
 */
@Slf4j
public class SimulatedPlacementBackend implements PlacementBackend {

    /**
     * CPU-only slots per zone when the zone does not list {@link CapacityReport#CPU}
     */
    static final int DEFAULT_CPU_SLOTS = 1000;

    private final String platform;

    private final Map<String, String> acceleratorMap;

    private final Clock clock;

    /**
     * Zone to capacity key to available units
     */
    private final Map<String, Map<String, Integer>> available = new LinkedHashMap<>();

    private final Map<String, Allocation> allocations = new LinkedHashMap<>();

    public SimulatedPlacementBackend(OrbitProperties.PlatformConfig config, Clock clock) {
        this.platform = config.getName();
        this.acceleratorMap = Map.copyOf(config.getAcceleratorMap());
        this.clock = clock;
        config.getZones().forEach((zone, capacity) -> available.put(zone, new LinkedHashMap<>(capacity)));
        log.info("Simulated platform {} initialized with zones {}", platform, available.keySet());
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public boolean supports(String acceleratorType) {
        if (acceleratorType == null) {
            return true;
        }
        return acceleratorMap.containsKey(acceleratorType)
            || available.values().stream().anyMatch(zone -> zone.containsKey(acceleratorType));
    }

    @Override
    public Mono<CapacityReport> queryCapacity(String acceleratorType) {
        return Mono.fromCallable(() -> {
            String key = capacityKey(acceleratorType);
            Map<String, Integer> perZone = new LinkedHashMap<>();
            synchronized (this) {
                available.forEach((zone, capacity) -> perZone.put(zone, unitsIn(capacity, key)));
            }
            return CapacityReport.builder()
                .platform(platform)
                .acceleratorType(key)
                .available(perZone)
                .build();
        });
    }

    @Override
    public Mono<List<Instance>> provision(ProvisionRequest request) {
        return Mono.fromCallable(() -> {
            String key = capacityKey(request.getAllocation().isNone() ? null : request.getAllocation().getType());
            int unitsPerInstance = Math.max(1, request.getAllocation().getCount());
            long required = (long) unitsPerInstance * request.getNodeCount();

            List<Instance> instances;
            synchronized (this) {
                Map<String, Integer> zone = available.get(request.getZone());
                if (zone == null) {
                    throw new ProvisioningException("Unknown zone " + request.getZone() + " on platform " + platform);
                }
                int free = unitsIn(zone, key);
                if (free < required) {
                    throw new ProvisioningException(String.format(
                        "Zone %s on %s has %d %s left, %d required", request.getZone(), platform, free, key, required));
                }
                zone.put(key, (int) (free - required));

                instances = new ArrayList<>(request.getNodeCount());
                for (int i = 0; i < request.getNodeCount(); i++) {
                    String instanceId = platform + "-" + UUID.randomUUID().toString().substring(0, 8);
                    allocations.put(instanceId, new Allocation(request.getZone(), key, unitsPerInstance));
                    instances.add(Instance.builder()
                        .instanceId(instanceId)
                        .platform(platform)
                        .zone(request.getZone())
                        .acceleratorAllocation(request.getAllocation())
                        .nodeAddress(instanceId + "." + request.getZone() + ".internal")
                        .phase(InstancePhase.PROVISIONING)
                        .createdAt(clock.instant())
                        .build());
                }
            }

            log.info("Provisioned {} instances of {} in {}/{}", instances.size(),
                request.getResourceName(), platform, request.getZone());
            return instances;
        });
    }

    @Override
    public Mono<Void> terminate(String instanceId) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                Allocation allocation = allocations.remove(instanceId);
                if (allocation == null) {
                    log.debug("Instance {} unknown on {}, nothing to terminate", instanceId, platform);
                    return;
                }
                available.get(allocation.zone).merge(allocation.key, allocation.units, Integer::sum);
            }
            log.info("Terminated instance {} on {}", instanceId, platform);
        });
    }

    @Override
    public Mono<HealthStatus> healthCheck(String instanceId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return allocations.containsKey(instanceId) ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
            }
        });
    }

    private String capacityKey(String acceleratorType) {
        return acceleratorType == null ? CapacityReport.CPU : acceleratorType;
    }

    private int unitsIn(Map<String, Integer> zone, String key) {
        Integer units = zone.get(key);
        if (units == null) {
            return CapacityReport.CPU.equals(key) ? zone.computeIfAbsent(key, k -> DEFAULT_CPU_SLOTS) : 0;
        }
        return units;
    }

    private static class Allocation {
        final String zone;
        final String key;
        final int units;

        Allocation(String zone, String key, int units) {
            this.zone = zone;
            this.key = key;
            this.units = units;
        }
    }
}
