package com.whereq.orbit.queue;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of one queue
 */
@Value
@Builder
public class QueueSnapshot {
    String name;

    /**
     * Resource currently admitted, null when the queue is free
     */
    String holder;

    /**
     * Waiting resources in arrival order
     */
    List<String> waiters;
}
