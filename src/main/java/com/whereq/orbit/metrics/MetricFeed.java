package com.whereq.orbit.metrics;

import com.whereq.orbit.model.Resource;
import reactor.core.publisher.Mono;

/**
 * Read-only source of the metric an elastic resource scales on:
 * pressure for processors, latency for services
 */
public interface MetricFeed {

    /**
     * Latest sample of the resource's scaling metric
     *
     * @param resource the elastic resource
     * @return Mono with the sample, empty when nothing has been observed yet
     */
    Mono<MetricSample> sample(Resource resource);
}
