package com.whereq.orbit.service;

import com.whereq.orbit.autoscale.Autoscaler;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.dto.MetricReport;
import com.whereq.orbit.dto.ResourceRequest;
import com.whereq.orbit.exception.DuplicateResourceException;
import com.whereq.orbit.exception.ResourceConflictException;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.metrics.ReportedMetricFeed;
import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.resource.AcceleratorCatalog;
import com.whereq.orbit.resource.SpecValidator;
import com.whereq.orbit.store.InMemoryResourceStore;
import com.whereq.orbit.support.MutableClock;
import com.whereq.orbit.support.TestResources;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceService Tests")
class ResourceServiceTest {

    private MutableClock clock;
    private InMemoryResourceStore store;
    private ReportedMetricFeed feed;
    private ResourceService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        store = new InMemoryResourceStore(clock);
        feed = new ReportedMetricFeed();
        Autoscaler autoscaler = new Autoscaler(feed, new OrbitProperties(), new SimpleMeterRegistry());
        service = new ResourceService(store,
            new SpecValidator(new AcceleratorCatalog(Map.of()), Set.of("system")),
            feed, autoscaler, clock);
    }

    @Test
    @DisplayName("Create stores the resource under the caller and the default namespace")
    void testCreate() {
        ResourceRequest request = request(TestResources.container("trainer"));
        request.setNamespace(null);

        StepVerifier.create(service.create(request, "bob"))
            .assertNext(resource -> {
                assertEquals("bob", resource.getOwner());
                assertEquals("default", resource.getNamespace());
                assertEquals(ResourcePhase.PENDING, resource.phase());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Create rejects a name that is already taken by the caller")
    void testCreateDuplicate() {
        service.create(request(TestResources.container("trainer")), "bob").block();

        StepVerifier.create(service.create(request(TestResources.container("trainer")), "bob"))
            .expectError(DuplicateResourceException.class)
            .verify();

        StepVerifier.create(service.create(request(TestResources.container("trainer")), "carol"))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    @DisplayName("A failed resource still holds its name against create")
    void testCreateOverFailed() {
        Resource failed = service.create(request(TestResources.container("trainer")), "bob").block();
        store.updateStatus(failed.getId(),
            failed.getStatus().toBuilder().phase(ResourcePhase.FAILED).build(), 1).block();

        StepVerifier.create(service.create(request(TestResources.container("trainer")), "bob"))
            .expectError(DuplicateResourceException.class)
            .verify();
    }

    @Test
    @DisplayName("Invalid specs never reach the store")
    void testCreateInvalid() {
        StepVerifier.create(service.create(request(TestResources.queuedContainer("trainer", "system")), "bob"))
            .expectError(ResourceValidationException.class)
            .verify();

        StepVerifier.create(store.list(ResourceFilter.all()).count())
            .expectNext(0L)
            .verifyComplete();
    }

    @Test
    @DisplayName("Update bumps the generation and keeps the identity")
    void testUpdate() {
        Resource created = service.create(request(TestResources.container("trainer")), "bob").block();
        ResourceRequest changed = request(TestResources.draft("ignored", ResourceKind.CONTAINER,
            TestResources.containerSpec().image("registry.example.com/trainer:2.0").build()));

        StepVerifier.create(service.update(created.getId(), changed))
            .assertNext(resource -> {
                assertEquals(created.getId(), resource.getId());
                assertEquals("trainer", resource.getName());
                assertEquals(2L, resource.getGeneration());
                assertEquals("registry.example.com/trainer:2.0", resource.getSpec().getImage());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("A resource being deleted cannot be updated")
    void testUpdateWhileDeleting() {
        Resource created = service.create(request(TestResources.container("trainer")), "bob").block();
        service.delete(created.getId()).block();

        StepVerifier.create(service.update(created.getId(), request(TestResources.container("trainer"))))
            .expectError(ResourceConflictException.class)
            .verify();
    }

    @Test
    @DisplayName("Metric reports default to the resource's own signal and the time of receipt")
    void testReportMetric() {
        Resource processor = service.create(request(
            TestResources.processor("ingest", 0, 5, ScalePolicy.builder().build())), "bob").block();

        StepVerifier.create(service.reportMetric(processor.getId(), MetricReport.builder().value(42.0).build()))
            .assertNext(sample -> {
                assertEquals(42.0, sample.getValue());
                assertEquals(clock.instant(), sample.getTimestamp());
            })
            .verifyComplete();

        assertEquals(42.0, feed.latest(processor.getId(), MetricSource.PRESSURE).orElseThrow().getValue());
    }

    @Test
    @DisplayName("Older metric reports do not replace newer ones")
    void testReportMetricOutOfOrder() {
        Resource api = service.create(request(
            TestResources.service("api", 1, 5, ScalePolicy.builder().build())), "bob").block();
        Instant now = clock.instant();

        service.reportMetric(api.getId(), MetricReport.builder().value(250.0).timestamp(now).build()).block();
        service.reportMetric(api.getId(),
            MetricReport.builder().value(10.0).timestamp(now.minusSeconds(30)).build()).block();

        assertEquals(250.0, feed.latest(api.getId(), MetricSource.LATENCY).orElseThrow().getValue());
    }

    @Test
    @DisplayName("Metrics are only accepted for elastic resources")
    void testReportMetricNotElastic() {
        Resource container = service.create(request(TestResources.container("trainer")), "bob").block();

        StepVerifier.create(service.reportMetric(container.getId(), MetricReport.builder().value(1.0).build()))
            .expectError(ResourceValidationException.class)
            .verify();
    }

    @Test
    @DisplayName("No autoscaler state before the first evaluation")
    void testAutoscalerSnapshotEmpty() {
        Resource api = service.create(request(
            TestResources.service("api", 1, 5, ScalePolicy.builder().build())), "bob").block();

        StepVerifier.create(service.autoscaler(api.getId()))
            .verifyComplete();
    }

    private static ResourceRequest request(ResourceDraft draft) {
        return ResourceRequest.builder()
            .name(draft.getName())
            .namespace(draft.getNamespace())
            .kind(draft.getKind())
            .spec(draft.getSpec())
            .build();
    }
}
