package com.whereq.orbit.service;

import com.whereq.orbit.autoscale.Autoscaler;
import com.whereq.orbit.autoscale.AutoscalerSnapshot;
import com.whereq.orbit.dto.MetricReport;
import com.whereq.orbit.dto.ResourceRequest;
import com.whereq.orbit.exception.DuplicateResourceException;
import com.whereq.orbit.exception.ResourceConflictException;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.metrics.MetricSample;
import com.whereq.orbit.metrics.ReportedMetricFeed;
import com.whereq.orbit.model.MetricSource;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.StatusEvent;
import com.whereq.orbit.resource.SpecValidator;
import com.whereq.orbit.store.ResourceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Service for resource submission and management
 */
@Slf4j
@Service
public class ResourceService {

    private final ResourceStore store;

    private final SpecValidator specValidator;

    private final ReportedMetricFeed reportedMetricFeed;

    private final Autoscaler autoscaler;

    private final Clock clock;

    @Autowired
    public ResourceService(ResourceStore store,
                           SpecValidator specValidator,
                           ReportedMetricFeed reportedMetricFeed,
                           Autoscaler autoscaler,
                           Clock clock) {
        this.store = store;
        this.specValidator = specValidator;
        this.reportedMetricFeed = reportedMetricFeed;
        this.autoscaler = autoscaler;
        this.clock = clock;
    }

    /**
     * Create a resource
     *
     * @param request desired state
     * @param owner tenant submitting the request
     * @return Mono with the stored resource; errors with DuplicateResourceException
     *         if a live resource already has the name
     */
    public Mono<Resource> create(ResourceRequest request, String owner) {
        ResourceDraft draft = draft(request, owner);

        return validate(draft)
            .then(store.list(ResourceFilter.builder()
                    .owner(owner)
                    .namespace(draft.getNamespace())
                    .build())
                .filter(existing -> existing.getName().equals(draft.getName()))
                .filter(existing -> !(existing.isDeletionRequested() && existing.phase().isTerminal()))
                .hasElements())
            .flatMap(exists -> exists
                ? Mono.error(new DuplicateResourceException(
                    "Resource " + draft.getNamespace() + "/" + draft.getName() + " already exists"))
                : store.putSpec(draft))
            .doOnSuccess(resource -> log.info("Resource {} ({}) submitted by {}",
                resource.getId(), resource.displayName(), owner))
            .doOnError(e -> log.error("Resource submission failed for {}: {}", owner, e.getMessage()));
    }

    /**
     * Replace the spec of an existing resource. Name and namespace stay as they are.
     *
     * @param id resource identifier
     * @param request desired state
     * @return Mono with the stored resource at its new generation
     */
    public Mono<Resource> update(String id, ResourceRequest request) {
        return store.get(id)
            .flatMap(existing -> {
                if (existing.isDeletionRequested()) {
                    return Mono.error(new ResourceConflictException(
                        "Resource " + existing.displayName() + " is being deleted"));
                }
                ResourceDraft draft = ResourceDraft.builder()
                    .name(existing.getName())
                    .namespace(existing.getNamespace())
                    .owner(existing.getOwner())
                    .kind(request.getKind())
                    .spec(request.getSpec())
                    .build();
                return validate(draft).then(store.putSpec(draft));
            })
            .doOnSuccess(resource -> log.info("Resource {} updated to generation {}",
                resource.getId(), resource.getGeneration()));
    }

    public Mono<Resource> get(String id) {
        return store.get(id);
    }

    public Flux<Resource> list(ResourceFilter filter) {
        return store.list(filter);
    }

    /**
     * Request deletion; the reconciler drains and terminates the instances
     */
    public Mono<Resource> delete(String id) {
        return store.delete(id)
            .doOnSuccess(resource -> log.info("Deletion of resource {} requested", id));
    }

    public Flux<StatusEvent> history(String id) {
        return store.history(id);
    }

    /**
     * Record a metric sample for an elastic resource
     *
     * @return Mono with the recorded sample
     */
    public Mono<MetricSample> reportMetric(String id, MetricReport report) {
        return store.get(id)
            .flatMap(resource -> {
                if (!resource.isElastic()) {
                    return Mono.error(new ResourceValidationException(
                        "Resource " + resource.displayName() + " is not elastic"));
                }
                MetricSource source = report.getSource() == null ? resource.metricSource() : report.getSource();
                Instant timestamp = report.getTimestamp() == null ? clock.instant() : report.getTimestamp();
                MetricSample sample = MetricSample.of(timestamp, report.getValue());
                reportedMetricFeed.report(id, source, sample);
                return Mono.just(sample);
            });
    }

    public Mono<AutoscalerSnapshot> autoscaler(String id) {
        return store.get(id)
            .flatMap(resource -> Mono.justOrEmpty(autoscaler.snapshot(resource.getId())));
    }

    private ResourceDraft draft(ResourceRequest request, String owner) {
        return ResourceDraft.builder()
            .name(request.getName())
            .namespace(request.getNamespace() == null || request.getNamespace().isBlank()
                ? "default" : request.getNamespace())
            .owner(owner)
            .kind(request.getKind())
            .spec(request.getSpec())
            .build();
    }

    /**
     * Reject specs the reconciler would fail anyway
     */
    private Mono<Void> validate(ResourceDraft draft) {
        return Mono.fromRunnable(() -> specValidator.validate(Resource.builder()
            .name(draft.getName())
            .namespace(draft.getNamespace())
            .owner(draft.getOwner())
            .kind(draft.getKind())
            .spec(draft.getSpec())
            .status(ResourceStatus.pending(clock.instant()))
            .build()));
    }
}
