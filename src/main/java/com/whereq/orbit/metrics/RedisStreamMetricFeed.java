package com.whereq.orbit.metrics;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Reads processor pressure straight from Redis: the number of entries the processors'
 * consumer group has taken from the stream but not yet acknowledged.
 * Latency is still taken from reported samples.
 */
@Slf4j
@Primary
@Component
@ConditionalOnProperty(prefix = "orbit.metrics", name = "pressure-source", havingValue = "redis-stream")
public class RedisStreamMetricFeed implements MetricFeed {

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    private final ReportedMetricFeed reportedFeed;

    private final String consumerGroup;

    private final Clock clock;

    @Autowired
    public RedisStreamMetricFeed(ReactiveRedisTemplate<String, String> redisTemplate,
                                 ReportedMetricFeed reportedFeed,
                                 OrbitProperties properties,
                                 Clock clock) {
        this.redisTemplate = redisTemplate;
        this.reportedFeed = reportedFeed;
        this.consumerGroup = properties.getMetrics().getConsumerGroup();
        this.clock = clock;
        log.info("Processor pressure read from Redis streams, consumer group {}", consumerGroup);
    }

    @Override
    public Mono<MetricSample> sample(Resource resource) {
        if (resource.metricSource() != MetricSource.PRESSURE || resource.getSpec().getProcessor() == null) {
            return reportedFeed.sample(resource);
        }

        String stream = resource.getSpec().getProcessor().getStream();
        return redisTemplate.opsForStream()
            .pending(stream, consumerGroup)
            .map(summary -> MetricSample.of(clock.instant(), summary.getTotalPendingMessages()))
            .onErrorResume(e -> {
                log.warn("Failed to read pending entries of stream {} for resource {}: {}",
                    stream, resource.getId(), e.getMessage());
                return Mono.empty();
            });
    }
}
