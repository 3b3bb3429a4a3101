package com.whereq.orbit.queue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;

/**
 * Mutable state of one queue: {@code Free} when there is no holder, {@code Held(id)} otherwise.
 * Not thread-safe; the controller serializes access per queue.
 */
class QueueState {

    private final String name;

    private String holder;

    private final LinkedHashSet<String> waiters = new LinkedHashSet<>();

    QueueState(String name) {
        this.name = name;
    }

    boolean isFree() {
        return holder == null;
    }

    boolean isHeldBy(String resourceId) {
        return resourceId.equals(holder);
    }

    void hold(String resourceId) {
        holder = resourceId;
    }

    /**
     * Append a waiter; a resource already waiting keeps its position
     */
    void addWaiter(String resourceId) {
        waiters.add(resourceId);
    }

    boolean removeWaiter(String resourceId) {
        return waiters.remove(resourceId);
    }

    /**
     * Hand the queue to the oldest waiter, or free it
     */
    Optional<String> promoteNext() {
        Iterator<String> it = waiters.iterator();
        if (!it.hasNext()) {
            holder = null;
            return Optional.empty();
        }
        String next = it.next();
        it.remove();
        holder = next;
        return Optional.of(next);
    }

    int position(String resourceId) {
        int position = 1;
        for (String waiter : waiters) {
            if (waiter.equals(resourceId)) {
                return position;
            }
            position++;
        }
        return -1;
    }

    int waiterCount() {
        return waiters.size();
    }

    QueueSnapshot snapshot() {
        return QueueSnapshot.builder()
            .name(name)
            .holder(holder)
            .waiters(new ArrayList<>(waiters))
            .build();
    }
}
