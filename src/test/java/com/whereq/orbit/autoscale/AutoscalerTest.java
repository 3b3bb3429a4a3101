package com.whereq.orbit.autoscale;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.metrics.MetricSample;
import com.whereq.orbit.metrics.ReportedMetricFeed;
import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.model.ScaleRule;
import com.whereq.orbit.support.TestResources;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Autoscaler Tests")
class AutoscalerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private OrbitProperties properties;
    private ReportedMetricFeed feed;
    private SimpleMeterRegistry meterRegistry;
    private Autoscaler autoscaler;

    @BeforeEach
    void setUp() {
        properties = new OrbitProperties();
        properties.getAutoscaler().setMinActionInterval(Duration.ofSeconds(30));
        feed = new ReportedMetricFeed();
        meterRegistry = new SimpleMeterRegistry();
        autoscaler = new Autoscaler(feed, properties, meterRegistry);
    }

    @Test
    @DisplayName("Scale-up fires only after the dwell duration has elapsed")
    void testScaleUpWaitsForDwell() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "10s")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        for (int second = 0; second < 10; second++) {
            ScaleDecision decision = autoscaler.evaluate(processor, sample(second, 150));
            assertFalse(decision.isAction(), "fired after " + second + "s");
            assertEquals(1, decision.getTarget());
        }

        ScaleDecision decision = autoscaler.evaluate(processor, sample(10, 150));
        assertTrue(decision.isAction());
        assertEquals(ScaleDirection.UP, decision.getDirection());
        assertEquals(1, decision.getPreviousTarget());
        assertEquals(2, decision.getTarget());
        assertEquals(0.0, meterRegistry.counter("orbit.autoscaler.decisions", "action", "up").count());

        autoscaler.recordAction(decision);
        processor = withTarget(processor, 2);
        assertFalse(autoscaler.evaluate(processor, sample(11, 150)).isAction());
        assertFalse(autoscaler.evaluate(processor, sample(12, 150)).isAction());
        assertEquals(1.0, meterRegistry.counter("orbit.autoscaler.decisions", "action", "up").count());
    }

    @Test
    @DisplayName("A sample below threshold restarts the dwell")
    void testDwellResetsWhenPredicateBreaks() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "10s")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        autoscaler.evaluate(processor, sample(0, 150));
        autoscaler.evaluate(processor, sample(6, 150));
        autoscaler.evaluate(processor, sample(7, 20));
        autoscaler.evaluate(processor, sample(8, 150));

        assertFalse(autoscaler.evaluate(processor, sample(12, 150)).isAction());
        assertTrue(autoscaler.evaluate(processor, sample(18, 150)).isAction());
    }

    @Test
    @DisplayName("Scale-to-zero after latency stays below threshold for the zero duration")
    void testScaleToZero() {
        ScalePolicy policy = ScalePolicy.builder().zero(rule(200.0, "10m")).build();
        Resource service = running(TestResources.service("api", 0, 4, policy), 2);

        ScaleDecision decision = null;
        for (int second = 0; second <= 11 * 60; second += 30) {
            decision = autoscaler.evaluate(service, sample(second, 45));
            if (decision.isAction()) {
                assertEquals(600, second);
                break;
            }
        }

        assertNotNull(decision);
        assertEquals(ScaleDirection.ZERO, decision.getDirection());
        assertEquals(0, decision.getTarget());
    }

    @Test
    @DisplayName("Zero rule without a threshold fires at a metric of zero")
    void testZeroRuleDefaultsToZeroThreshold() {
        ScalePolicy policy = ScalePolicy.builder().zero(ScaleRule.builder().duration("0s").build()).build();
        Resource service = running(TestResources.service("api", 0, 4, policy), 1);

        assertFalse(autoscaler.evaluate(service, sample(0, 3)).isAction());
        ScaleDecision decision = autoscaler.evaluate(service, sample(1, 0));
        assertEquals(ScaleDirection.ZERO, decision.getDirection());
    }

    @Test
    @DisplayName("Zero rule is ignored when the minimum is above zero")
    void testZeroNeedsZeroMinimum() {
        ScalePolicy policy = ScalePolicy.builder().zero(rule(200.0, "")).build();
        Resource service = running(TestResources.service("api", 1, 4, policy), 2);

        ScaleDecision decision = autoscaler.evaluate(service, sample(0, 10));
        assertFalse(decision.isAction());
        assertEquals(2, decision.getTarget());
    }

    @Test
    @DisplayName("Targets are clamped to the instance bounds")
    void testTargetClamped() {
        properties.getAutoscaler().setScaleUpStep(5);
        properties.getAutoscaler().setScaleDownStep(5);
        properties.getAutoscaler().setMinActionInterval(Duration.ZERO);
        ScalePolicy policy = ScalePolicy.builder()
            .up(rule(100.0, ""))
            .down(rule(10.0, ""))
            .build();
        Resource processor = running(TestResources.processor("ingest", 1, 3, policy), 1);

        ScaleDecision up = autoscaler.evaluate(processor, sample(0, 500));
        assertEquals(3, up.getTarget());

        processor = withTarget(processor, 3);
        ScaleDecision atMax = autoscaler.evaluate(processor, sample(1, 500));
        assertFalse(atMax.isAction());
        assertEquals(3, atMax.getTarget());

        ScaleDecision down = autoscaler.evaluate(processor, sample(2, 0));
        assertEquals(ScaleDirection.DOWN, down.getDirection());
        assertEquals(1, down.getTarget());

        processor = withTarget(processor, 1);
        ScaleDecision atMin = autoscaler.evaluate(processor, sample(3, 0));
        assertFalse(atMin.isAction());
        assertEquals(1, atMin.getTarget());
    }

    @Test
    @DisplayName("No two actions within the minimum action interval")
    void testAntiFlap() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        ScaleDecision first = autoscaler.evaluate(processor, sample(0, 150));
        assertTrue(first.isAction());
        autoscaler.recordAction(first);
        processor = withTarget(processor, 2);

        ScaleDecision throttled = autoscaler.evaluate(processor, sample(10, 150));
        assertFalse(throttled.isAction());
        assertEquals("Throttled (too soon)", throttled.getReason());
        assertFalse(autoscaler.evaluate(processor, sample(29, 150)).isAction());

        ScaleDecision next = autoscaler.evaluate(processor, sample(30, 150));
        assertTrue(next.isAction());
        assertEquals(3, next.getTarget());
        assertEquals(2.0, meterRegistry.counter("orbit.autoscaler.throttled").count());
    }

    @Test
    @DisplayName("A decision that was never persisted neither holds nor counts")
    void testUnrecordedDecisionLeavesStateAlone() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        assertTrue(autoscaler.evaluate(processor, sample(0, 150)).isAction());

        ScaleDecision retried = autoscaler.evaluate(processor, sample(5, 150));
        assertTrue(retried.isAction());
        assertEquals(2, retried.getTarget());
        assertNull(autoscaler.snapshot(processor.getId()).orElseThrow().getLastScaleActionTime());
        assertEquals(0.0, meterRegistry.counter("orbit.autoscaler.decisions", "action", "up").count());
        assertEquals(0.0, meterRegistry.counter("orbit.autoscaler.throttled").count());
    }

    @Test
    @DisplayName("Zero wins over down when both fire")
    void testZeroPrecedesDown() {
        ScalePolicy policy = ScalePolicy.builder()
            .up(rule(100.0, ""))
            .down(rule(10.0, ""))
            .zero(rule(0.0, ""))
            .build();
        Resource service = running(TestResources.service("api", 0, 4, policy), 3);

        ScaleDecision decision = autoscaler.evaluate(service, sample(0, 0));
        assertEquals(ScaleDirection.ZERO, decision.getDirection());
        assertEquals(0, decision.getTarget());
    }

    @Test
    @DisplayName("Out-of-order samples are ignored")
    void testStaleSampleIgnored() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        autoscaler.evaluate(processor, sample(5, 10));
        ScaleDecision decision = autoscaler.evaluate(processor, sample(4, 900));

        assertFalse(decision.isAction());
        assertEquals("Stale sample", decision.getReason());
        assertEquals(1, autoscaler.snapshot(processor.getId()).orElseThrow().getWindowSize());
    }

    @Test
    @DisplayName("The sample window keeps only the configured number of samples")
    void testWindowBounded() {
        properties.getAutoscaler().setWindowSize(3);
        autoscaler = new Autoscaler(feed, properties, new SimpleMeterRegistry());
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "1h")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);

        for (int second = 0; second < 10; second++) {
            autoscaler.evaluate(processor, sample(second, 1));
        }

        AutoscalerSnapshot snapshot = autoscaler.snapshot(processor.getId()).orElseThrow();
        assertEquals(3, snapshot.getWindowSize());
        assertEquals(T0.plusSeconds(9), snapshot.getLastSample().getTimestamp());
    }

    @Test
    @DisplayName("Resources that are not running are not evaluated")
    void testSkipsResourcesNotRunning() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        ResourceDraft draft = TestResources.processor("ingest", 1, 10, policy);
        Resource provisioning = TestResources.resource("res-1", draft,
            ResourceStatus.builder().phase(ResourcePhase.PROVISIONING).build());
        feed.report("res-1", MetricSource.PRESSURE, sample(0, 500));

        StepVerifier.create(autoscaler.evaluate(provisioning))
            .verifyComplete();
    }

    @Test
    @DisplayName("Evaluation reads the latest sample from the metric feed")
    void testEvaluateFromFeed() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);
        feed.report(processor.getId(), MetricSource.PRESSURE, sample(0, 500));

        StepVerifier.create(autoscaler.evaluate(processor))
            .assertNext(decision -> {
                assertEquals(ScaleDirection.UP, decision.getDirection());
                assertEquals(2, decision.getTarget());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Discarded state starts over from the persisted target")
    void testDiscard() {
        ScalePolicy policy = ScalePolicy.builder().up(rule(100.0, "")).build();
        Resource processor = running(TestResources.processor("ingest", 1, 10, policy), 1);
        autoscaler.evaluate(processor, sample(0, 500));

        autoscaler.discard(processor.getId());

        assertTrue(autoscaler.snapshot(processor.getId()).isEmpty());
        assertEquals(0.0, meterRegistry.get("orbit.autoscaler.tracked").gauge().value());
    }

    private static ScaleRule rule(Double threshold, String duration) {
        return ScaleRule.builder().threshold(threshold).duration(duration).build();
    }

    private static MetricSample sample(int second, double value) {
        return MetricSample.of(T0.plusSeconds(second), value);
    }

    private static Resource running(ResourceDraft draft, int target) {
        return TestResources.resource("res-" + draft.getName(), draft, ResourceStatus.builder()
            .phase(ResourcePhase.RUNNING)
            .targetInstances(target)
            .build());
    }

    private static Resource withTarget(Resource resource, int target) {
        return resource.toBuilder()
            .status(resource.getStatus().toBuilder().targetInstances(target).build())
            .build();
    }
}
