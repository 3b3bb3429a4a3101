package com.whereq.orbit.metrics;

import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest sample pushed for each resource and metric source
 */
@Slf4j
@Component
public class ReportedMetricFeed implements MetricFeed {

    private final Map<String, Map<MetricSource, MetricSample>> latest = new ConcurrentHashMap<>();

    /**
     * Record a sample. Samples older than the one already held are ignored.
     *
     * @return true if the sample became the latest one
     */
    public boolean report(String resourceId, MetricSource source, MetricSample sample) {
        Map<MetricSource, MetricSample> samples = latest.computeIfAbsent(resourceId, k -> new EnumMap<>(MetricSource.class));
        synchronized (samples) {
            MetricSample previous = samples.get(source);
            if (previous != null && sample.getTimestamp().isBefore(previous.getTimestamp())) {
                log.debug("Ignoring out-of-order {} sample for resource {}", source, resourceId);
                return false;
            }
            samples.put(source, sample);
        }
        log.debug("Resource {} reported {}={}", resourceId, source, sample.getValue());
        return true;
    }

    public Optional<MetricSample> latest(String resourceId, MetricSource source) {
        Map<MetricSource, MetricSample> samples = latest.get(resourceId);
        if (samples == null) {
            return Optional.empty();
        }
        synchronized (samples) {
            return Optional.ofNullable(samples.get(source));
        }
    }

    public void forget(String resourceId) {
        latest.remove(resourceId);
    }

    @Override
    public Mono<MetricSample> sample(Resource resource) {
        return Mono.justOrEmpty(latest(resource.getId(), resource.metricSource()));
    }
}
