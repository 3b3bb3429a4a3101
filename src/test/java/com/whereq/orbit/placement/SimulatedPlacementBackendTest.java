package com.whereq.orbit.placement;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ProvisioningException;
import com.whereq.orbit.model.AcceleratorRequest;
import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.InstancePhase;
import com.whereq.orbit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SimulatedPlacementBackend Tests")
class SimulatedPlacementBackendTest {

    private SimulatedPlacementBackend backend;

    @BeforeEach
    void setUp() {
        OrbitProperties.PlatformConfig config = new OrbitProperties.PlatformConfig();
        config.setName("gce");
        config.setAcceleratorMap(Map.of("A100_SXM", "nvidia-tesla-a100"));
        Map<String, Map<String, Integer>> zones = new LinkedHashMap<>();
        zones.put("us-central1-a", Map.of("A100_SXM", 4, CapacityReport.CPU, 2));
        zones.put("us-central1-b", Map.of("A100_SXM", 8));
        config.setZones(zones);
        backend = new SimulatedPlacementBackend(config, MutableClock.startingAt("2026-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Capacity is reported per zone in configuration order")
    void testQueryCapacity() {
        StepVerifier.create(backend.queryCapacity("A100_SXM"))
            .assertNext(report -> {
                assertEquals(List.of("us-central1-a", "us-central1-b"), List.copyOf(report.getAvailable().keySet()));
                assertEquals(12, report.total());
                assertEquals("us-central1-b", report.zoneFor(6).orElseThrow());
            })
            .verifyComplete();

        StepVerifier.create(backend.queryCapacity(null))
            .assertNext(report -> {
                assertEquals(2, report.getAvailable().get("us-central1-a"));
                assertEquals(SimulatedPlacementBackend.DEFAULT_CPU_SLOTS, report.getAvailable().get("us-central1-b"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Provisioning consumes capacity and termination gives it back")
    void testProvisionAndTerminate() {
        List<Instance> instances = backend.provision(request("us-central1-a", 2, 2)).block();

        assertEquals(2, instances.size());
        assertTrue(instances.stream().allMatch(i -> i.getPhase() == InstancePhase.PROVISIONING));
        assertEquals(0, backend.queryCapacity("A100_SXM").block().getAvailable().get("us-central1-a"));
        assertEquals(HealthStatus.HEALTHY, backend.healthCheck(instances.get(0).getInstanceId()).block());

        backend.terminate(instances.get(0).getInstanceId()).block();
        backend.terminate(instances.get(0).getInstanceId()).block();

        assertEquals(2, backend.queryCapacity("A100_SXM").block().getAvailable().get("us-central1-a"));
        assertEquals(HealthStatus.UNHEALTHY, backend.healthCheck(instances.get(0).getInstanceId()).block());
    }

    @Test
    @DisplayName("Provisioning beyond the zone's capacity fails without consuming any")
    void testProvisionOverCapacity() {
        StepVerifier.create(backend.provision(request("us-central1-a", 2, 3)))
            .expectError(ProvisioningException.class)
            .verify();
        StepVerifier.create(backend.provision(request("europe-west4-a", 1, 1)))
            .expectError(ProvisioningException.class)
            .verify();

        assertEquals(4, backend.queryCapacity("A100_SXM").block().getAvailable().get("us-central1-a"));
    }

    @Test
    @DisplayName("A unit total past the int range fails instead of wrapping into free capacity")
    void testProvisionOverflow() {
        StepVerifier.create(backend.provision(request("us-central1-b", 64, 1 << 25)))
            .expectError(ProvisioningException.class)
            .verify();

        assertEquals(8, backend.queryCapacity("A100_SXM").block().getAvailable().get("us-central1-b"));
    }

    @Test
    @DisplayName("Supported accelerators come from the map and the zones")
    void testSupports() {
        assertTrue(backend.supports(null));
        assertTrue(backend.supports("A100_SXM"));
        assertFalse(backend.supports("H100_SXM"));
    }

    private static ProvisionRequest request(String zone, int perNode, int nodes) {
        return ProvisionRequest.builder()
            .resourceId("res-1")
            .resourceName("default/trainer")
            .image("registry.example.com/trainer:1.4")
            .zone(zone)
            .allocation(AcceleratorRequest.builder().count(perNode).type("A100_SXM").build())
            .platformAcceleratorType("nvidia-tesla-a100")
            .nodeCount(nodes)
            .build();
    }
}
