package com.whereq.orbit.reconcile;

import com.whereq.orbit.autoscale.Autoscaler;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.metrics.MetricSample;
import com.whereq.orbit.metrics.ReportedMetricFeed;
import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.model.ScaleRule;
import com.whereq.orbit.placement.CapacityReport;
import com.whereq.orbit.placement.PlacementBackendRegistry;
import com.whereq.orbit.queue.QueueAdmissionController;
import com.whereq.orbit.resource.AcceleratorCatalog;
import com.whereq.orbit.resource.SpecValidator;
import com.whereq.orbit.scheduler.PlacementScheduler;
import com.whereq.orbit.store.InMemoryResourceStore;
import com.whereq.orbit.support.FakePlacementBackend;
import com.whereq.orbit.support.TestResources;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the loop against real components and a fake platform, on the wall clock
 */
@DisplayName("ReconciliationLoop Tests")
class ReconciliationLoopTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryResourceStore store;
    private FakePlacementBackend ec2;
    private ReportedMetricFeed feed;
    private Autoscaler autoscaler;
    private ReconcileWorkQueue workQueue;
    private ResourceLockManager lockManager;
    private ReconciliationLoop loop;
    private OrbitProperties properties;
    private ResourceReconciler reconciler;
    private QueueAdmissionController queueController;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        properties = new OrbitProperties();
        properties.getReconcile().setRecheckInterval(Duration.ofMillis(20));
        properties.getReconcile().setWorkers(2);

        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryResourceStore(clock);
        ec2 = new FakePlacementBackend("ec2", clock)
            .withCapacity(CapacityReport.CPU, "us-east-1a", 10);

        PlacementBackendRegistry registry = new PlacementBackendRegistry(List.of(ec2));
        AcceleratorCatalog catalog = new AcceleratorCatalog(Map.of());
        queueController = new QueueAdmissionController(meterRegistry);
        feed = new ReportedMetricFeed();
        autoscaler = new Autoscaler(feed, properties, meterRegistry);
        reconciler = new ResourceReconciler(store, queueController,
            new PlacementScheduler(registry, catalog, meterRegistry), registry, autoscaler,
            new SpecValidator(catalog, properties), properties, clock, meterRegistry);

        workQueue = new ReconcileWorkQueue();
        lockManager = new ResourceLockManager(properties, clock);
        loop = new ReconciliationLoop(store, reconciler, workQueue, lockManager,
            queueController, autoscaler, properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    @DisplayName("A new resource is driven to RUNNING by store events alone")
    void testDrivesToRunning() {
        loop.start();

        Resource created = store.putSpec(TestResources.container("trainer")).block();

        Resource running = await(created.getId(), ResourcePhase.RUNNING);
        assertEquals(1, running.getStatus().activeInstances().size());
        assertEquals(1, ec2.getProvisionRequests().size());
    }

    @Test
    @DisplayName("Deleting the holder of a queue lets the next resource run")
    void testQueueHandOver() {
        loop.start();

        Resource first = store.putSpec(TestResources.queuedContainer("first", "gpu-pool")).block();
        await(first.getId(), ResourcePhase.RUNNING);
        Resource second = store.putSpec(TestResources.queuedContainer("second", "gpu-pool")).block();
        await(second.getId(), ResourcePhase.QUEUED);

        store.delete(first.getId()).block();

        await(first.getId(), ResourcePhase.TERMINATED);
        await(second.getId(), ResourcePhase.RUNNING);
        assertEquals(1, ec2.getTerminated().size());
    }

    @Test
    @DisplayName("Resources stored before start are picked up by the first sweep")
    void testStartupSweep() {
        Resource created = store.putSpec(TestResources.container("trainer")).block();

        loop.start();

        await(created.getId(), ResourcePhase.RUNNING);
    }

    @Test
    @DisplayName("A resource whose lease is taken is left alone")
    void testBusyResourceDeferred() {
        Resource created = store.putSpec(TestResources.container("trainer")).block();
        Optional<ResourceLockManager.Lease> lease = lockManager.tryAcquire(created.getId());
        assertTrue(lease.isPresent());

        StepVerifier.create(loop.process(created.getId()))
            .verifyComplete();

        assertEquals(ResourcePhase.PENDING, store.get(created.getId()).block().phase());
        assertFalse(workQueue.isPending(created.getId()));
        lockManager.release(lease.get());
    }

    @Test
    @DisplayName("A lease released between the failed acquire and the deferral still gets the id queued")
    void testDeferralRacingRelease() {
        Resource created = store.putSpec(TestResources.container("trainer")).block();
        // Loses every acquire, yet nobody holds the lease afterwards
        ResourceLockManager racing = new ResourceLockManager(properties, Clock.systemUTC()) {
            @Override
            public Optional<Lease> tryAcquire(String resourceId) {
                return Optional.empty();
            }
        };
        ReconciliationLoop racingLoop = new ReconciliationLoop(store, reconciler, workQueue, racing,
            queueController, autoscaler, properties, new SimpleMeterRegistry());

        StepVerifier.create(racingLoop.process(created.getId()))
            .verifyComplete();

        assertTrue(workQueue.isPending(created.getId()));
    }

    @Test
    @DisplayName("An autoscaler tick persists the new target and the loop places the extra instance")
    void testAutoscalingTick() {
        loop.start();
        ScalePolicy policy = ScalePolicy.builder()
            .up(ScaleRule.builder().threshold(100.0).duration("").build())
            .build();
        Resource created = store.putSpec(TestResources.service("api", 1, 4, policy)).block();
        await(created.getId(), ResourcePhase.RUNNING);

        feed.report(created.getId(), MetricSource.LATENCY, MetricSample.of(Instant.now(), 500));
        loop.evaluateAutoscaling();

        Resource scaled = store.get(created.getId())
            .filter(resource -> resource.getStatus().activeInstances().size() == 2)
            .repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(20)))
            .block(TIMEOUT);
        assertEquals(2, scaled.getStatus().getTargetInstances());
        assertNotNull(autoscaler.snapshot(created.getId()).orElseThrow().getLastScaleActionTime());
        assertEquals(1.0, meterRegistry.counter("orbit.autoscaler.decisions", "action", "up").count());
    }

    private Resource await(String id, ResourcePhase phase) {
        return store.get(id)
            .filter(resource -> resource.phase() == phase)
            .repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(20)))
            .block(TIMEOUT);
    }
}
