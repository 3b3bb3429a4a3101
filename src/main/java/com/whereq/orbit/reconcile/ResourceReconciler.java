package com.whereq.orbit.reconcile;

import com.whereq.orbit.autoscale.Autoscaler;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.BackendException;
import com.whereq.orbit.exception.NoCapacityException;
import com.whereq.orbit.exception.ResourceConflictException;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import com.whereq.orbit.model.InstancePhase;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.RestartPolicy;
import com.whereq.orbit.model.RetryPolicy;
import com.whereq.orbit.placement.PlacementBackendRegistry;
import com.whereq.orbit.queue.AdmissionDecision;
import com.whereq.orbit.queue.QueueAdmissionController;
import com.whereq.orbit.resource.DurationParser;
import com.whereq.orbit.resource.SpecValidator;
import com.whereq.orbit.scheduler.PlacementDecision;
import com.whereq.orbit.scheduler.PlacementScheduler;
import com.whereq.orbit.store.ResourceStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lifecycle state machine of a resource.
 * <p>
 * Each call to {@link #reconcile(String)} reads the resource, performs at most one phase
 * step (calling the queue controller, the scheduler and the placement backends as needed)
 * and writes the resulting status with optimistic concurrency. A step that finds the
 * resource where it should be writes nothing.
 * </p>
 * <pre>
 * PENDING → QUEUED → SCHEDULING → PROVISIONING → RUNNING → TERMINATING → TERMINATED
 *                                                    ↓ template or queue change
 *                                                 DRAINING → PENDING
 * any non-terminal phase → FAILED (invalid spec, retries exhausted, unhealthy with restart=NEVER)
 * </pre>
 */
@Slf4j
@Service
public class ResourceReconciler {

    private final ResourceStore store;

    private final QueueAdmissionController queueController;

    private final PlacementScheduler scheduler;

    private final Autoscaler autoscaler;

    private final SpecValidator specValidator;

    private final InstanceOperations instances;

    private final OrbitProperties properties;

    private final Clock clock;

    private final Timer reconcileTimer;
    private final Counter transitionCounter;
    private final Counter conflictCounter;
    private final Counter retryCounter;
    private final Counter failedCounter;

    @Autowired
    public ResourceReconciler(ResourceStore store,
                              QueueAdmissionController queueController,
                              PlacementScheduler scheduler,
                              PlacementBackendRegistry backendRegistry,
                              Autoscaler autoscaler,
                              SpecValidator specValidator,
                              OrbitProperties properties,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.store = store;
        this.queueController = queueController;
        this.scheduler = scheduler;
        this.autoscaler = autoscaler;
        this.specValidator = specValidator;
        this.properties = properties;
        this.clock = clock;

        this.reconcileTimer = Timer.builder("orbit.reconcile.time")
            .description("Time spent in one reconciliation step")
            .register(meterRegistry);

        this.transitionCounter = Counter.builder("orbit.reconcile.writes")
            .description("Status writes made by the reconciler")
            .register(meterRegistry);

        this.conflictCounter = Counter.builder("orbit.reconcile.conflicts")
            .description("Status writes that had to be rebased on a newer record")
            .register(meterRegistry);

        this.retryCounter = Counter.builder("orbit.reconcile.retries")
            .description("Transient backend failures scheduled for retry")
            .register(meterRegistry);

        this.failedCounter = Counter.builder("orbit.reconcile.failed")
            .description("Resources that reached FAILED")
            .register(meterRegistry);

        Counter forcedDrains = Counter.builder("orbit.reconcile.forced-drains")
            .description("Draining instances terminated on drain timeout")
            .register(meterRegistry);

        this.instances = new InstanceOperations(backendRegistry,
            properties.getAutoscaler().getDrainTimeout(), forcedDrains);
    }

    /**
     * Run one step of the state machine for a resource
     *
     * @param resourceId resource identifier
     * @return Mono with the transition, {@link Transition#getCommitted()} holding the stored resource
     */
    public Mono<Transition> reconcile(String resourceId) {
        long start = System.nanoTime();
        return store.get(resourceId)
            .flatMap(this::step)
            .flatMap(this::commit)
            .doFinally(signal -> reconcileTimer.record(Duration.ofNanos(System.nanoTime() - start)));
    }

    /**
     * Persist a new autoscaler target for a running elastic resource
     *
     * @return Mono with the stored resource, empty if the resource is no longer running
     */
    public Mono<Resource> applyTarget(String resourceId, int target) {
        return Mono.defer(() -> store.get(resourceId)
                .filter(resource -> resource.phase() == ResourcePhase.RUNNING && !resource.isDeletionRequested())
                .flatMap(resource -> {
                    if (Integer.valueOf(target).equals(resource.getStatus().getTargetInstances())) {
                        return Mono.just(resource);
                    }
                    ResourceStatus status = resource.getStatus().toBuilder().targetInstances(target).build();
                    return store.updateStatus(resourceId, status, resource.getResourceVersion());
                }))
            .retryWhen(Retry.max(properties.getReconcile().getConflictRetries())
                .filter(e -> e instanceof ResourceConflictException)
                .doBeforeRetry(signal -> conflictCounter.increment()));
    }

    Mono<Transition> step(Resource resource) {
        ResourcePhase phase = resource.phase();
        if (phase.isTerminal()) {
            return Mono.just(settled(resource));
        }
        if (resource.isDeletionRequested() && phase != ResourcePhase.TERMINATING && phase != ResourcePhase.DRAINING) {
            return terminating(resource);
        }

        Mono<Transition> next = switch (phase) {
            case PENDING -> pending(resource);
            case QUEUED -> Mono.just(queued(resource));
            case SCHEDULING -> scheduling(resource);
            case PROVISIONING -> provisioning(resource);
            case RUNNING -> running(resource);
            case DRAINING -> draining(resource);
            case TERMINATING -> terminating(resource);
            case TERMINATED, FAILED -> Mono.just(settled(resource));
        };
        return next.map(this::untilTimeout);
    }

    /**
     * Terminal resources hold nothing: no queue membership, no autoscaler state
     */
    private Transition settled(Resource resource) {
        queueController.leave(resource.getId());
        autoscaler.discard(resource.getId());
        return Transition.unchanged(resource);
    }

    private Mono<Transition> pending(Resource resource) {
        try {
            specValidator.validate(resource);
        } catch (ResourceValidationException e) {
            return fail(resource, resource.getStatus().getInstances(), "Invalid spec: " + e.getMessage());
        }

        ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder()
            .observedGeneration(resource.getGeneration())
            .retryCount(0)
            .nextAttemptAt(null)
            .queuePosition(null);

        if (!resource.hasQueue()) {
            queueController.leave(resource.getId());
            return Mono.just(to(resource, status, ResourcePhase.SCHEDULING, "Scheduling"));
        }

        String queue = resource.getSpec().getQueue();
        AdmissionDecision decision = queueController.enqueue(queue, resource.getId());
        if (decision == AdmissionDecision.ADMITTED) {
            return Mono.just(to(resource, status, ResourcePhase.SCHEDULING, "Admitted to queue " + queue));
        }
        return Mono.just(to(resource,
            status.queuePosition(queueController.position(queue, resource.getId()).orElse(null)),
            ResourcePhase.QUEUED, "Waiting for queue " + queue));
    }

    private Transition queued(Resource resource) {
        if (!resource.isSpecObserved() || !resource.hasQueue()) {
            return to(resource, resource.getStatus().toBuilder().queuePosition(null), ResourcePhase.PENDING, "Spec updated");
        }

        String queue = resource.getSpec().getQueue();
        AdmissionDecision decision = queueController.isHolder(queue, resource.getId())
            ? AdmissionDecision.ADMITTED
            : queueController.enqueue(queue, resource.getId());

        if (decision == AdmissionDecision.ADMITTED) {
            return to(resource, resource.getStatus().toBuilder().queuePosition(null),
                ResourcePhase.SCHEDULING, "Admitted to queue " + queue);
        }
        return to(resource,
            resource.getStatus().toBuilder()
                .queuePosition(queueController.position(queue, resource.getId()).orElse(null)),
            ResourcePhase.QUEUED, "Waiting for queue " + queue);
    }

    private Mono<Transition> scheduling(Resource resource) {
        if (!resource.isSpecObserved()) {
            return Mono.just(to(resource, resource.getStatus().toBuilder(), ResourcePhase.PENDING, "Spec updated"));
        }

        Instant now = clock.instant();
        Instant nextAttempt = resource.getStatus().getNextAttemptAt();
        if (nextAttempt != null && now.isBefore(nextAttempt)) {
            return Mono.just(Transition.unchanged(resource, Duration.between(now, nextAttempt)));
        }

        String fingerprint = resource.getSpec().templateFingerprint();
        List<Instance> stale = resource.getStatus().activeInstances().stream()
            .filter(i -> !fingerprint.equals(i.getTemplateHash()))
            .toList();

        return instances.terminate(stale)
            .flatMap(terminated -> {
                List<Instance> current = InstanceOperations.merge(resource.getStatus().getInstances(), terminated);
                return place(resource, current);
            })
            .onErrorResume(e -> Mono.just(waiting(resource, resource.getStatus().toBuilder(),
                "Failed to terminate outdated instances: " + e.getMessage())));
    }

    private Mono<Transition> place(Resource resource, List<Instance> current) {
        List<Instance> serving = serving(current);
        int missing = resource.desiredInstances() - serving.size();
        ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder().instances(current);

        if (missing <= 0) {
            return Mono.just(to(resource, status.nextAttemptAt(null), ResourcePhase.PROVISIONING,
                healthMessage(current, resource.desiredInstances())));
        }

        Instance anchor = resource.getKind() == ResourceKind.CLUSTER && !serving.isEmpty() ? serving.get(0) : null;

        return scheduler.place(resource, missing, anchor)
            .map(decision -> {
                List<Instance> created = stamp(resource, decision);
                List<Instance> all = new ArrayList<>(current);
                all.addAll(created);
                return to(resource, resource.getStatus().toBuilder().instances(all).nextAttemptAt(null),
                    ResourcePhase.PROVISIONING, placedMessage(decision))
                    .toBuilder().created(created).build();
            })
            .onErrorResume(NoCapacityException.class, e -> Mono.just(
                waiting(resource, status, e.getMessage())))
            .onErrorResume(ResourceValidationException.class,
                e -> fail(resource, current, "Invalid spec: " + e.getMessage()))
            .onErrorResume(e -> !(e instanceof NoCapacityException) && !(e instanceof ResourceValidationException),
                e -> transientFailure(resource, current, e));
    }

    private Mono<Transition> provisioning(Resource resource) {
        Instant now = clock.instant();
        List<Instance> current = resource.getStatus().getInstances();

        return instances.health(serving(current))
            .flatMap(health -> {
                List<Instance> updated = new ArrayList<>(current.size());
                List<Instance> unhealthy = new ArrayList<>();
                for (Instance instance : current) {
                    HealthStatus status = health.get(instance.getInstanceId());
                    if (status == null) {
                        updated.add(instance);
                    } else if (status == HealthStatus.HEALTHY) {
                        updated.add(instance.withPhase(InstancePhase.RUNNING));
                    } else if (status == HealthStatus.UNHEALTHY || provisioningTimedOut(instance, now)) {
                        unhealthy.add(instance);
                        updated.add(instance);
                    } else {
                        updated.add(instance);
                    }
                }

                if (!unhealthy.isEmpty()) {
                    return replaceUnhealthy(resource, updated, unhealthy)
                        .flatMap(afterReplace -> transientFailure(resource, afterReplace,
                            new BackendException("Instance " + unhealthy.get(0).getInstanceId()
                                + " did not become healthy")));
                }

                int desired = resource.desiredInstances();
                int missing = desired - serving(updated).size();
                if (missing > 0) {
                    return Mono.just(to(resource, resource.getStatus().toBuilder().instances(updated),
                        ResourcePhase.SCHEDULING, "Placing " + missing + " missing instance(s)"));
                }

                long running = updated.stream().filter(i -> i.getPhase() == InstancePhase.RUNNING).count();
                if (running >= desired) {
                    List<Instance> active = updated.stream().filter(Instance::isActive).toList();
                    Instant startedAt = resource.getStatus().getStartedAt() != null
                        ? resource.getStatus().getStartedAt()
                        : now;
                    return Mono.just(to(resource,
                        resource.getStatus().toBuilder().instances(active).retryCount(0).nextAttemptAt(null)
                            .startedAt(startedAt),
                        ResourcePhase.RUNNING, runningMessage(active)));
                }

                return Mono.just(waiting(resource, resource.getStatus().toBuilder().instances(updated),
                    healthMessage(updated, desired)));
            })
            .onErrorResume(e -> Mono.just(waiting(resource, resource.getStatus().toBuilder(),
                "Failed to replace unhealthy instances: " + e.getMessage())));
    }

    private Mono<Transition> running(Resource resource) {
        if (!resource.isSpecObserved()) {
            return respec(resource);
        }

        Instant now = clock.instant();
        List<Instance> current = resource.getStatus().getInstances();

        Instant deadline = timeoutDeadline(resource, resource.getStatus());
        if (deadline != null && !deadline.isAfter(now)) {
            return fail(resource, current,
                "Container terminated after exceeding timeout of " + resource.getSpec().getTimeout());
        }

        return instances.health(serving(current))
            .flatMap(health -> {
                List<Instance> updated = new ArrayList<>(current.size());
                List<Instance> unhealthy = new ArrayList<>();
                for (Instance instance : current) {
                    HealthStatus status = health.get(instance.getInstanceId());
                    if (status == HealthStatus.HEALTHY && instance.getPhase() == InstancePhase.PROVISIONING) {
                        updated.add(instance.withPhase(InstancePhase.RUNNING));
                    } else if (status == HealthStatus.UNHEALTHY
                        || (status == HealthStatus.UNKNOWN && instance.getPhase() == InstancePhase.PROVISIONING
                            && provisioningTimedOut(instance, now))) {
                        unhealthy.add(instance);
                        updated.add(instance);
                    } else {
                        updated.add(instance);
                    }
                }

                if (unhealthy.isEmpty()) {
                    return steadyState(resource, updated, now);
                }

                String reason = "Instance " + unhealthy.get(0).getInstanceId() + " is unhealthy";
                if (resource.getSpec().getRestart() == RestartPolicy.NEVER) {
                    return fail(resource, updated, reason + " and restart policy is NEVER");
                }

                log.warn("Resource {}: {}, restarting", resource.getId(), reason);
                return replaceUnhealthy(resource, updated, unhealthy)
                    .flatMap(afterReplace -> resource.isElastic()
                        ? steadyState(resource, afterReplace, now)
                        : Mono.just(to(resource, resource.getStatus().toBuilder().instances(afterReplace),
                            ResourcePhase.SCHEDULING, reason + ", restarting")));
            })
            .onErrorResume(e -> Mono.just(waiting(resource, resource.getStatus().toBuilder(),
                "Failed to replace unhealthy instances: " + e.getMessage())));
    }

    /**
     * Spec changed while running: apply what can be applied in place, re-admit and
     * replace instances otherwise
     */
    private Mono<Transition> respec(Resource resource) {
        try {
            specValidator.validate(resource);
        } catch (ResourceValidationException e) {
            return fail(resource, resource.getStatus().getInstances(), "Invalid spec: " + e.getMessage());
        }

        if (resource.hasQueue() && !queueController.isHolder(resource.getSpec().getQueue(), resource.getId())) {
            return Mono.just(to(resource, resource.getStatus().toBuilder(), ResourcePhase.DRAINING,
                "Queue changed to " + resource.getSpec().getQueue() + ", re-admitting"));
        }
        if (!resource.hasQueue()) {
            queueController.leave(resource.getId());
        }

        String fingerprint = resource.getSpec().templateFingerprint();
        boolean outdated = resource.getStatus().servingInstances().stream()
            .anyMatch(i -> !fingerprint.equals(i.getTemplateHash()));
        if (outdated) {
            return Mono.just(to(resource, resource.getStatus().toBuilder(), ResourcePhase.DRAINING,
                "Spec template changed, replacing instances"));
        }

        log.info("Resource {} applies generation {} in place", resource.getId(), resource.getGeneration());
        return Mono.just(to(resource, resource.getStatus().toBuilder().observedGeneration(resource.getGeneration()),
            ResourcePhase.RUNNING, runningMessage(resource.getStatus().activeInstances())));
    }

    /**
     * RUNNING housekeeping: finish drains and, for elastic resources, move toward the target
     */
    private Mono<Transition> steadyState(Resource resource, List<Instance> current, Instant now) {
        return instances.advanceDrains(current, now)
            .flatMap(drained -> {
                List<Instance> active = drained.stream().filter(Instance::isActive).toList();
                if (!resource.isElastic()) {
                    if (serving(active).size() < resource.desiredInstances()) {
                        return Mono.just(to(resource, resource.getStatus().toBuilder().instances(active),
                            ResourcePhase.SCHEDULING, "Instances lost, rescheduling"));
                    }
                    return Mono.just(runningTransition(resource, resource.getStatus().toBuilder().instances(active), active));
                }
                return scale(resource, active, now);
            });
    }

    private Mono<Transition> scale(Resource resource, List<Instance> active, Instant now) {
        int desired = resource.desiredInstances();
        List<Instance> serving = serving(active);
        ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder().instances(active);

        if (serving.size() > desired) {
            int surplus = serving.size() - desired;
            // Newest first; the list is in creation order
            List<Instance> toDrain = serving.subList(desired, serving.size()).stream()
                .map(i -> i.draining(now))
                .toList();
            List<Instance> updated = InstanceOperations.merge(active, toDrain);
            log.info("Resource {} draining {} instance(s) to reach {}", resource.getId(), surplus, desired);
            return Mono.just(runningTransition(resource, status.instances(updated), updated));
        }

        if (serving.size() == desired) {
            return Mono.just(runningTransition(resource, status, active));
        }

        Instant nextAttempt = resource.getStatus().getNextAttemptAt();
        if (nextAttempt != null && now.isBefore(nextAttempt)) {
            return Mono.just(runningTransition(resource, status, active));
        }

        int missing = desired - serving.size();
        log.info("Resource {} scaling up by {} to {}", resource.getId(), missing, desired);
        return scheduler.place(resource, missing)
            .map(decision -> {
                List<Instance> created = stamp(resource, decision);
                List<Instance> all = new ArrayList<>(active);
                all.addAll(created);
                return runningTransition(resource,
                    status.instances(all).retryCount(0).nextAttemptAt(null), all)
                    .toBuilder().created(created).build();
            })
            .onErrorResume(ResourceValidationException.class,
                e -> fail(resource, active, "Invalid spec: " + e.getMessage()))
            .onErrorResume(NoCapacityException.class, e -> {
                Transition transition = runningTransition(resource, status, active);
                return Mono.just(withMessage(transition, "Scale-up waiting for capacity: " + e.getMessage()));
            })
            .onErrorResume(e -> !(e instanceof NoCapacityException) && !(e instanceof ResourceValidationException), e -> {
                int failures = resource.getStatus().getRetryCount() + 1;
                Duration backoff = retryPolicy(resource).backoff(failures);
                retryCounter.increment();
                log.warn("Resource {} scale-up attempt {} failed, retrying in {}: {}",
                    resource.getId(), failures, backoff, e.getMessage());
                Transition transition = runningTransition(resource,
                    status.retryCount(failures).nextAttemptAt(now.plus(backoff)), active);
                return Mono.just(withMessage(transition, "Scale-up failed: " + e.getMessage()));
            });
    }

    private Mono<Transition> draining(Resource resource) {
        Instant now = clock.instant();
        List<Instance> started = resource.getStatus().getInstances().stream()
            .map(i -> i.getPhase() == InstancePhase.PROVISIONING || i.getPhase() == InstancePhase.RUNNING
                ? i.draining(now) : i)
            .toList();

        return instances.advanceDrains(started, now)
            .map(drained -> {
                long remaining = drained.stream().filter(Instance::isActive).count();
                ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder().instances(drained);
                if (remaining > 0) {
                    return waiting(resource, status, "Draining " + remaining + " instance(s)");
                }
                if (resource.isDeletionRequested()) {
                    return to(resource, status, ResourcePhase.TERMINATING, "Drained, terminating");
                }
                return to(resource, status, ResourcePhase.PENDING, "Drained, re-evaluating");
            });
    }

    private Mono<Transition> terminating(Resource resource) {
        Instant now = clock.instant();
        List<Instance> current = resource.getStatus().getInstances();
        List<Instance> provisioning = current.stream()
            .filter(i -> i.getPhase() == InstancePhase.PROVISIONING)
            .toList();

        return instances.terminate(provisioning)
            .onErrorResume(e -> {
                log.warn("Resource {}: failed to terminate provisioning instances: {}", resource.getId(), e.getMessage());
                return Mono.just(List.of());
            })
            .map(terminated -> InstanceOperations.merge(current, terminated).stream()
                .map(i -> i.getPhase() == InstancePhase.RUNNING ? i.draining(now) : i)
                .toList())
            .flatMap(started -> instances.advanceDrains(started, now))
            .map(drained -> {
                long remaining = drained.stream().filter(Instance::isActive).count();
                ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder().instances(drained);
                if (remaining > 0) {
                    return waiting(resource, status, ResourcePhase.TERMINATING,
                        "Terminating " + remaining + " instance(s)");
                }
                String id = resource.getId();
                return to(resource, status.queuePosition(null).nextAttemptAt(null), ResourcePhase.TERMINATED, "Deleted")
                    .toBuilder()
                    .afterCommit(List.of(() -> queueController.leave(id), () -> autoscaler.discard(id)))
                    .build();
            });
    }

    /**
     * Terminate the unhealthy instances and mark them FAILED
     */
    private Mono<List<Instance>> replaceUnhealthy(Resource resource, List<Instance> current, List<Instance> unhealthy) {
        log.warn("Resource {}: terminating unhealthy instances {}", resource.getId(),
            unhealthy.stream().map(Instance::getInstanceId).collect(Collectors.joining(", ")));
        return instances.terminate(unhealthy)
            .map(terminated -> InstanceOperations.merge(current, terminated.stream()
                .map(i -> i.withPhase(InstancePhase.FAILED))
                .toList()));
    }

    private Mono<Transition> transientFailure(Resource resource, List<Instance> current, Throwable error) {
        int failures = resource.getStatus().getRetryCount() + 1;
        RetryPolicy policy = retryPolicy(resource);

        if (policy.isExhausted(failures)) {
            return fail(resource, current, String.format("Giving up after %d failures: %s", failures, error.getMessage()));
        }

        Duration backoff = policy.backoff(failures);
        retryCounter.increment();
        log.warn("Resource {} attempt {} of {} failed, retrying in {}: {}",
            resource.getId(), failures, policy.getMaxRetries() + 1, backoff, error.getMessage());

        ResourceStatus.ResourceStatusBuilder status = resource.getStatus().toBuilder()
            .instances(current)
            .retryCount(failures)
            .nextAttemptAt(clock.instant().plus(backoff));
        Transition transition = to(resource, status, ResourcePhase.SCHEDULING,
            String.format("Attempt %d failed, retrying in %ds: %s", failures, backoff.toSeconds(), error.getMessage()));
        return Mono.just(transition.toBuilder().requeueAfter(backoff).build());
    }

    /**
     * Terminate every active instance, then enter FAILED. If termination fails the
     * resource stays where it is and the next pass tries again.
     */
    private Mono<Transition> fail(Resource resource, List<Instance> current, String message) {
        List<Instance> active = current.stream().filter(Instance::isActive).toList();
        return instances.terminate(active)
            .map(terminated -> failNow(resource, InstanceOperations.merge(current, terminated), message))
            .onErrorResume(e -> Mono.just(waiting(resource, resource.getStatus().toBuilder().instances(current),
                "Cleaning up before failing (" + message + "): " + e.getMessage())));
    }

    /**
     * Enter FAILED; every instance is already gone
     */
    private Transition failNow(Resource resource, List<Instance> current, String message) {
        String id = resource.getId();
        failedCounter.increment();
        log.error("Resource {} failed: {}", id, message);
        return to(resource, resource.getStatus().toBuilder().instances(current).queuePosition(null).nextAttemptAt(null),
            ResourcePhase.FAILED, message)
            .toBuilder()
            .afterCommit(List.of(() -> queueController.leave(id), () -> autoscaler.discard(id)))
            .build();
    }

    private Mono<Transition> commit(Transition transition) {
        if (!transition.isChanged()) {
            return Mono.just(transition);
        }
        return write(transition, 0)
            .doOnNext(committed -> {
                transitionCounter.increment();
                ResourcePhase from = committed.getResource().phase();
                ResourcePhase to = committed.getCommitted().phase();
                if (from != to) {
                    log.info("Resource {} {} -> {}: {}", committed.getCommitted().getId(), from, to,
                        committed.getCommitted().getStatus().getMessage());
                }
                committed.getAfterCommit().forEach(Runnable::run);
            });
    }

    private Mono<Transition> write(Transition transition, int attempt) {
        Resource basis = transition.getResource();
        return store.updateStatus(basis.getId(), transition.getStatus(), basis.getResourceVersion())
            .map(stored -> transition.toBuilder().committed(stored).build())
            .onErrorResume(ResourceConflictException.class, e -> {
                if (attempt >= properties.getReconcile().getConflictRetries()) {
                    return Mono.error(e);
                }
                conflictCounter.increment();
                log.debug("Status write of resource {} conflicted, rebasing: {}", basis.getId(), e.getMessage());
                return store.get(basis.getId())
                    .flatMap(fresh -> write(rebase(transition, fresh), attempt + 1));
            });
    }

    /**
     * Carry a step computed on a stale record over to the fresh one. Only this
     * reconciler writes status, so the fresh record differs by its spec or by a
     * deletion request; a deletion wins, keeping the instances the step knows about
     * (including any it just created) so termination finds them.
     */
    private Transition rebase(Transition transition, Resource fresh) {
        if (fresh.isDeletionRequested() && !transition.getResource().isDeletionRequested()) {
            if (!transition.getCreated().isEmpty()) {
                log.info("Resource {} was deleted while placing, handing {} new instance(s) to termination",
                    fresh.getId(), transition.getCreated().size());
            }
            ResourceStatus merged = fresh.getStatus().toBuilder()
                .instances(transition.getStatus().getInstances())
                .build();
            return transition.toBuilder()
                .resource(fresh)
                .status(merged)
                .afterCommit(List.of())
                .requeueAfter(null)
                .build();
        }
        return transition.toBuilder().resource(fresh).build();
    }

    private Transition to(Resource resource, ResourceStatus.ResourceStatusBuilder builder,
                          ResourcePhase phase, String message) {
        ResourceStatus current = resource.getStatus();
        builder.phase(phase).message(message);
        if (current.getPhase() != phase) {
            builder.lastTransitionTime(clock.instant());
        }
        ResourceStatus next = builder.build();
        if (next.equals(current)) {
            return Transition.unchanged(resource, requeueFor(next));
        }
        return Transition.builder()
            .resource(resource)
            .status(next)
            .requeueAfter(requeueFor(next))
            .build();
    }

    /**
     * Stay in the current phase and look again shortly
     */
    private Transition waiting(Resource resource, ResourceStatus.ResourceStatusBuilder builder, String message) {
        return waiting(resource, builder, resource.phase(), message);
    }

    private Transition waiting(Resource resource, ResourceStatus.ResourceStatusBuilder builder,
                               ResourcePhase phase, String message) {
        Transition transition = to(resource, builder, phase, message);
        return transition.toBuilder().requeueAfter(properties.getReconcile().getRecheckInterval()).build();
    }

    private Transition runningTransition(Resource resource, ResourceStatus.ResourceStatusBuilder builder,
                                         List<Instance> active) {
        return to(resource, builder, ResourcePhase.RUNNING, runningMessage(active));
    }

    private Transition withMessage(Transition transition, String message) {
        ResourceStatus base = transition.isChanged() ? transition.getStatus() : transition.getResource().getStatus();
        return to(transition.getResource(), base.toBuilder(), base.getPhase(), message)
            .toBuilder()
            .requeueAfter(properties.getReconcile().getRecheckInterval())
            .build();
    }

    /**
     * Phases that wait on backends get looked at again without an event
     */
    private Duration requeueFor(ResourceStatus status) {
        boolean inMotion = status.getInstances().stream()
            .anyMatch(i -> i.getPhase() == InstancePhase.PROVISIONING || i.getPhase() == InstancePhase.DRAINING);
        return switch (status.getPhase()) {
            case PROVISIONING, DRAINING, TERMINATING -> properties.getReconcile().getRecheckInterval();
            case RUNNING -> inMotion ? properties.getReconcile().getRecheckInterval() : null;
            default -> null;
        };
    }

    /**
     * A running container with a timeout is looked at again no later than its deadline
     */
    private Transition untilTimeout(Transition transition) {
        ResourceStatus status = transition.isChanged() ? transition.getStatus() : transition.getResource().getStatus();
        if (status.getPhase() != ResourcePhase.RUNNING
            || status.getObservedGeneration() != transition.getResource().getGeneration()) {
            return transition;
        }
        Instant deadline = timeoutDeadline(transition.getResource(), status);
        if (deadline == null) {
            return transition;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        Duration requeue = transition.getRequeueAfter();
        if (requeue != null && requeue.compareTo(remaining) <= 0) {
            return transition;
        }
        return transition.toBuilder().requeueAfter(remaining).build();
    }

    /**
     * End of a container's allowed run time, null without a timeout or before it started
     */
    private static Instant timeoutDeadline(Resource resource, ResourceStatus status) {
        if (resource.getKind() != ResourceKind.CONTAINER || resource.getSpec().getTimeout() == null
            || status.getStartedAt() == null) {
            return null;
        }
        return status.getStartedAt().plus(DurationParser.parse(resource.getSpec().getTimeout()));
    }

    private boolean provisioningTimedOut(Instance instance, Instant now) {
        return instance.getCreatedAt() != null
            && !instance.getCreatedAt().plus(properties.getReconcile().getProvisioningTimeout()).isAfter(now);
    }

    private RetryPolicy retryPolicy(Resource resource) {
        return resource.getSpec().getRetryPolicy() != null
            ? resource.getSpec().getRetryPolicy()
            : properties.getRetry();
    }

    private static List<Instance> serving(List<Instance> instances) {
        return instances.stream()
            .filter(i -> i.getPhase() == InstancePhase.PROVISIONING || i.getPhase() == InstancePhase.RUNNING)
            .toList();
    }

    private static List<Instance> stamp(Resource resource, PlacementDecision decision) {
        String fingerprint = resource.getSpec().templateFingerprint();
        return decision.getInstances().stream()
            .map(i -> i.toBuilder()
                .templateHash(fingerprint)
                .phase(i.getPhase() == null ? InstancePhase.PROVISIONING : i.getPhase())
                .build())
            .toList();
    }

    private static String placedMessage(PlacementDecision decision) {
        return String.format("Placed %d instance(s) on %s/%s with %s",
            decision.getInstances().size(), decision.getPlatform(), decision.getZone(), decision.getAllocation());
    }

    private static String healthMessage(List<Instance> instances, int desired) {
        long running = instances.stream().filter(i -> i.getPhase() == InstancePhase.RUNNING).count();
        return String.format("%d/%d instance(s) healthy", running, desired);
    }

    private static String runningMessage(List<Instance> instances) {
        Map<InstancePhase, Long> counts = instances.stream()
            .filter(Instance::isActive)
            .collect(Collectors.groupingBy(Instance::getPhase, Collectors.counting()));
        StringBuilder message = new StringBuilder()
            .append(counts.getOrDefault(InstancePhase.RUNNING, 0L)).append(" instance(s) running");
        if (counts.containsKey(InstancePhase.PROVISIONING)) {
            message.append(", ").append(counts.get(InstancePhase.PROVISIONING)).append(" provisioning");
        }
        if (counts.containsKey(InstancePhase.DRAINING)) {
            message.append(", ").append(counts.get(InstancePhase.DRAINING)).append(" draining");
        }
        return message.toString();
    }
}
