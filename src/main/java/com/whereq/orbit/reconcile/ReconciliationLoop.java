package com.whereq.orbit.reconcile;

import com.whereq.orbit.autoscale.Autoscaler;
import com.whereq.orbit.autoscale.ScaleDecision;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.queue.QueueAdmissionController;
import com.whereq.orbit.store.ResourceStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the reconciler: a worker pool consumes resource ids from the work queue, one
 * lease-protected reconciliation per id at a time.
 * <p>
 * Ids are queued by store change events, queue promotions, timed re-checks requested by
 * the reconciler, autoscaler ticks and the periodic resync sweep.
 * </p>
 */
@Slf4j
@Service
public class ReconciliationLoop {

    private final ResourceStore store;

    private final ResourceReconciler reconciler;

    private final ReconcileWorkQueue workQueue;

    private final ResourceLockManager lockManager;

    private final QueueAdmissionController queueController;

    private final Autoscaler autoscaler;

    private final int workers;

    /**
     * Ids that were queued while a worker held their lease
     */
    private final Set<String> deferred = ConcurrentHashMap.newKeySet();

    private final Disposable.Composite subscriptions = Disposables.composite();

    private final Counter errorCounter;

    @Autowired
    public ReconciliationLoop(ResourceStore store,
                              ResourceReconciler reconciler,
                              ReconcileWorkQueue workQueue,
                              ResourceLockManager lockManager,
                              QueueAdmissionController queueController,
                              Autoscaler autoscaler,
                              OrbitProperties properties,
                              MeterRegistry meterRegistry) {
        this.store = store;
        this.reconciler = reconciler;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.queueController = queueController;
        this.autoscaler = autoscaler;
        this.workers = Math.max(1, properties.getReconcile().getWorkers());

        this.errorCounter = Counter.builder("orbit.reconcile.errors")
            .description("Reconciliations that ended with an unexpected error")
            .register(meterRegistry);

        Gauge.builder("orbit.reconcile.queue.size", workQueue::size)
            .description("Resource ids waiting for a worker")
            .register(meterRegistry);

        Gauge.builder("orbit.reconcile.leases", lockManager::activeLeases)
            .description("Resources currently being reconciled")
            .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        log.info("Starting reconciliation loop with {} workers", workers);

        queueController.restore(store.list(ResourceFilter.active()).collectList().block(Duration.ofSeconds(30)));
        queueController.onPromotion(workQueue::enqueue);

        subscriptions.add(store.changes()
            .subscribe(event -> workQueue.enqueue(event.getResourceId()),
                e -> log.error("Store change stream terminated", e)));

        subscriptions.add(workQueue.consume()
            .flatMap(id -> process(id)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    errorCounter.increment();
                    log.error("Error reconciling resource {}: {}", id, e.getMessage(), e);
                    return Mono.empty();
                }), workers)
            .doOnError(e -> log.error("Fatal error in reconciliation loop", e))
            .retry()
            .subscribe());

        resync();
        log.info("Reconciliation loop started successfully");
    }

    @PreDestroy
    public void stop() {
        subscriptions.dispose();
        log.info("Reconciliation loop stopped");
    }

    /**
     * Periodic full sweep over live resources, recovering from missed events
     */
    @Scheduled(fixedRateString = "${orbit.reconcile.resync-interval-ms:30000}",
        initialDelayString = "${orbit.reconcile.resync-interval-ms:30000}")
    public void resync() {
        lockManager.reclaimExpired();
        store.list(ResourceFilter.active())
            .doOnNext(resource -> workQueue.enqueue(resource.getId()))
            .count()
            .subscribe(count -> log.debug("Resync queued {} resources", count),
                e -> log.error("Resync sweep failed: {}", e.getMessage(), e));
    }

    /**
     * Autoscaler tick: evaluate every running elastic resource and persist new targets
     */
    @Scheduled(fixedRateString = "${orbit.autoscaler.evaluation-interval-ms:5000}")
    public void evaluateAutoscaling() {
        store.list(ResourceFilter.active())
            .filter(Resource::isElastic)
            .flatMap(resource -> autoscaler.evaluate(resource)
                .filter(ScaleDecision::isAction)
                .flatMap(decision -> reconciler.applyTarget(decision.getResourceId(), decision.getTarget())
                    .doOnNext(stored -> autoscaler.recordAction(decision)))
                .onErrorResume(e -> {
                    log.error("Autoscaler evaluation of resource {} failed: {}", resource.getId(), e.getMessage(), e);
                    return Mono.empty();
                }))
            .subscribe();
    }

    /**
     * Reconcile one resource under its lease. A busy id is parked and queued again
     * when the current holder lets go.
     */
    Mono<Transition> process(String resourceId) {
        return Mono.defer(() -> {
            Optional<ResourceLockManager.Lease> lease = lockManager.tryAcquire(resourceId);
            if (lease.isEmpty()) {
                deferred.add(resourceId);
                // The holder may have let go between tryAcquire and add
                if (!lockManager.isLocked(resourceId) && deferred.remove(resourceId)) {
                    workQueue.enqueue(resourceId);
                    return Mono.empty();
                }
                log.debug("Resource {} is being reconciled, deferring", resourceId);
                return Mono.empty();
            }

            return reconciler.reconcile(resourceId)
                .doOnNext(this::scheduleRecheck)
                .doFinally(signal -> {
                    lockManager.release(lease.get());
                    if (deferred.remove(resourceId)) {
                        workQueue.enqueue(resourceId);
                    }
                });
        });
    }

    private void scheduleRecheck(Transition transition) {
        Duration delay = transition.getRequeueAfter();
        if (delay == null) {
            return;
        }
        String id = transition.getResource().getId();
        Mono.delay(delay).subscribe(tick -> workQueue.enqueue(id));
    }
}
