package com.whereq.orbit.controller;

import com.whereq.orbit.queue.QueueAdmissionController;
import com.whereq.orbit.queue.QueueSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/queues")
@Tag(name = "Queues", description = "Queue holders and waiters")
public class QueueController {

    @Autowired
    private QueueAdmissionController queueAdmissionController;

    @GetMapping
    @Operation(summary = "List queues", description = "Holder and waiters of every known queue")
    public Mono<ResponseEntity<List<QueueSnapshot>>> list() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(queueAdmissionController.snapshots()));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get queue", description = "Holder and waiters of one queue")
    public Mono<ResponseEntity<QueueSnapshot>> get(@PathVariable String name) {
        return Mono.fromSupplier(() -> queueAdmissionController.snapshot(name)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
