package com.whereq.orbit.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * De-duplicating queue of resource ids waiting to be reconciled.
 * An id is queued at most once; it can be queued again as soon as a worker has taken it.
 */
@Slf4j
@Component
public class ReconcileWorkQueue {

    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();

    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    /**
     * Queue a resource id
     *
     * @return false if the id was already waiting
     */
    public boolean enqueue(String resourceId) {
        if (!pending.add(resourceId)) {
            return false;
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(resourceId);
        }
        if (result.isFailure()) {
            pending.remove(resourceId);
            log.error("Failed to queue resource {} for reconciliation: {}", resourceId, result);
            return false;
        }
        return true;
    }

    /**
     * The stream of queued ids. Single subscriber.
     */
    public Flux<String> consume() {
        return sink.asFlux().doOnNext(pending::remove);
    }

    public int size() {
        return pending.size();
    }

    public boolean isPending(String resourceId) {
        return pending.contains(resourceId);
    }
}
