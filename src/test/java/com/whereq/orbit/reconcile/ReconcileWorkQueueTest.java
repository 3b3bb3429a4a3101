package com.whereq.orbit.reconcile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconcileWorkQueue Tests")
class ReconcileWorkQueueTest {

    @Test
    @DisplayName("An id waiting in the queue is not queued twice")
    void testDeduplicates() {
        ReconcileWorkQueue queue = new ReconcileWorkQueue();

        assertTrue(queue.enqueue("res-1"));
        assertFalse(queue.enqueue("res-1"));
        assertTrue(queue.enqueue("res-2"));
        assertEquals(2, queue.size());

        StepVerifier.create(queue.consume().take(2))
            .expectNext("res-1", "res-2")
            .verifyComplete();
    }

    @Test
    @DisplayName("A delivered id can be queued again")
    void testRequeueAfterDelivery() {
        ReconcileWorkQueue queue = new ReconcileWorkQueue();
        queue.enqueue("res-1");

        StepVerifier.create(queue.consume().take(2))
            .expectNext("res-1")
            .then(() -> {
                assertFalse(queue.isPending("res-1"));
                assertTrue(queue.enqueue("res-1"));
            })
            .expectNext("res-1")
            .verifyComplete();
    }
}
