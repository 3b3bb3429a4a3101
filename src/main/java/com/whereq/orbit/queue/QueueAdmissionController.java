package com.whereq.orbit.queue;

import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourcePhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Serializes access to named FIFO queues: at most one holder per queue, waiters admitted
 * strictly in arrival order.
 * <p>
 * Every operation on a queue runs under that queue's monitor. A resource is a member
 * (holder or waiter) of at most one queue; enqueueing it elsewhere first removes it from
 * its previous queue.
 * </p>
 */
@Slf4j
@Service
public class QueueAdmissionController {

    private final Map<String, QueueState> queues = new ConcurrentHashMap<>();

    /**
     * Resource id to the queue it is a member of
     */
    private final Map<String, String> membership = new ConcurrentHashMap<>();

    private final List<Consumer<String>> promotionListeners = new CopyOnWriteArrayList<>();

    private final Counter admittedCounter;
    private final Counter waitingCounter;
    private final Counter promotedCounter;

    @Autowired
    public QueueAdmissionController(MeterRegistry meterRegistry) {
        admittedCounter = Counter.builder("orbit.queue.admitted")
            .description("Resources admitted to a free queue on arrival")
            .register(meterRegistry);

        waitingCounter = Counter.builder("orbit.queue.waiting")
            .description("Resources that had to wait for a queue")
            .register(meterRegistry);

        promotedCounter = Counter.builder("orbit.queue.promoted")
            .description("Waiters promoted to holder on release")
            .register(meterRegistry);

        Gauge.builder("orbit.queue.waiters", this::totalWaiters)
            .description("Resources currently waiting across all queues")
            .register(meterRegistry);
    }

    /**
     * Register a callback invoked with the id of every resource promoted to holder
     */
    public void onPromotion(Consumer<String> listener) {
        promotionListeners.add(listener);
    }

    /**
     * Ask for admission to a queue
     *
     * @param queueName queue name, null or blank bypasses admission
     * @param resourceId resource identifier
     * @return ADMITTED if the queue was free or already held by the resource, WAITING otherwise
     */
    public AdmissionDecision enqueue(String queueName, String resourceId) {
        if (queueName == null || queueName.isBlank()) {
            return AdmissionDecision.ADMITTED;
        }

        String previous = membership.get(resourceId);
        if (previous != null && !previous.equals(queueName)) {
            log.info("Resource {} moves from queue {} to {}", resourceId, previous, queueName);
            remove(previous, resourceId);
        }

        QueueState queue = queue(queueName);
        AdmissionDecision decision;
        synchronized (queue) {
            if (queue.isHeldBy(resourceId)) {
                return AdmissionDecision.ADMITTED;
            }
            if (queue.isFree()) {
                queue.hold(resourceId);
                membership.put(resourceId, queueName);
                admittedCounter.increment();
                decision = AdmissionDecision.ADMITTED;
            } else {
                if (queue.position(resourceId) < 0) {
                    waitingCounter.increment();
                }
                queue.addWaiter(resourceId);
                membership.put(resourceId, queueName);
                decision = AdmissionDecision.WAITING;
            }
        }

        log.info("Resource {} {} queue {}", resourceId,
            decision == AdmissionDecision.ADMITTED ? "admitted to" : "waiting for", queueName);
        return decision;
    }

    /**
     * Release a queue held by a resource and promote the oldest waiter.
     * A release from anything but the current holder is a no-op.
     *
     * @param queueName queue name
     * @param resourceId resource releasing the queue
     * @return the promoted resource, if any
     */
    public Optional<String> release(String queueName, String resourceId) {
        if (queueName == null || queueName.isBlank()) {
            return Optional.empty();
        }
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }

        Optional<String> promoted;
        synchronized (queue) {
            if (!queue.isHeldBy(resourceId)) {
                log.debug("Ignoring release of queue {} by non-holder {}", queueName, resourceId);
                return Optional.empty();
            }
            membership.remove(resourceId, queueName);
            promoted = queue.promoteNext();
        }

        if (promoted.isPresent()) {
            promotedCounter.increment();
            log.info("Queue {} released by {}, promoted {}", queueName, resourceId, promoted.get());
            notifyPromotion(promoted.get());
        } else {
            log.info("Queue {} released by {}, now free", queueName, resourceId);
        }
        return promoted;
    }

    /**
     * Drop a resource from a queue: waiters leave without disturbing the order of the
     * rest, a holder releases the queue
     *
     * @return the promoted resource when a holder was removed
     */
    public Optional<String> remove(String queueName, String resourceId) {
        if (queueName == null || queueName.isBlank()) {
            return Optional.empty();
        }
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }

        synchronized (queue) {
            if (queue.removeWaiter(resourceId)) {
                membership.remove(resourceId, queueName);
                log.info("Resource {} left queue {} while waiting", resourceId, queueName);
                return Optional.empty();
            }
        }
        return release(queueName, resourceId);
    }

    /**
     * Drop a resource from whatever queue it is a member of
     *
     * @return the promoted resource when the resource was a holder
     */
    public Optional<String> leave(String resourceId) {
        String queueName = membership.get(resourceId);
        return queueName == null ? Optional.empty() : remove(queueName, resourceId);
    }

    public Optional<String> queueOf(String resourceId) {
        return Optional.ofNullable(membership.get(resourceId));
    }

    /**
     * Check if a resource currently holds a queue (always true without a queue)
     */
    public boolean isHolder(String queueName, String resourceId) {
        if (queueName == null || queueName.isBlank()) {
            return true;
        }
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            return false;
        }
        synchronized (queue) {
            return queue.isHeldBy(resourceId);
        }
    }

    /**
     * 1-based position among the waiters, empty when not waiting
     */
    public Optional<Integer> position(String queueName, String resourceId) {
        QueueState queue = queueName == null ? null : queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }
        synchronized (queue) {
            int position = queue.position(resourceId);
            return position < 0 ? Optional.empty() : Optional.of(position);
        }
    }

    public Optional<QueueSnapshot> snapshot(String queueName) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }
        synchronized (queue) {
            return Optional.of(queue.snapshot());
        }
    }

    public List<QueueSnapshot> snapshots() {
        List<QueueSnapshot> result = new ArrayList<>();
        queues.keySet().stream().sorted().forEach(name -> snapshot(name).ifPresent(result::add));
        return result;
    }

    /**
     * Rebuild the queue table from stored resources after a restart. Resources past
     * admission become holders, queued ones wait in the order they entered QUEUED.
     */
    public void restore(List<Resource> resources) {
        resources.stream()
            .filter(Resource::hasQueue)
            .filter(r -> r.phase().holdsQueue())
            .forEach(r -> {
                QueueState queue = queue(r.getSpec().getQueue());
                synchronized (queue) {
                    if (queue.isFree()) {
                        queue.hold(r.getId());
                        membership.put(r.getId(), r.getSpec().getQueue());
                    } else if (!queue.isHeldBy(r.getId())) {
                        log.warn("Queue {} already held by another resource, {} waits", r.getSpec().getQueue(), r.getId());
                        queue.addWaiter(r.getId());
                        membership.put(r.getId(), r.getSpec().getQueue());
                    }
                }
            });

        resources.stream()
            .filter(Resource::hasQueue)
            .filter(r -> r.phase() == ResourcePhase.QUEUED)
            .sorted(Comparator.comparing(r -> r.getStatus().getLastTransitionTime()))
            .forEach(r -> enqueue(r.getSpec().getQueue(), r.getId()));

        log.info("Restored {} queues from the resource store", queues.size());
    }

    private QueueState queue(String name) {
        return queues.computeIfAbsent(name, QueueState::new);
    }

    private int totalWaiters() {
        int total = 0;
        for (QueueState queue : queues.values()) {
            synchronized (queue) {
                total += queue.waiterCount();
            }
        }
        return total;
    }

    private void notifyPromotion(String resourceId) {
        for (Consumer<String> listener : promotionListeners) {
            try {
                listener.accept(resourceId);
            } catch (RuntimeException e) {
                log.error("Promotion listener failed for resource {}", resourceId, e);
            }
        }
    }
}
