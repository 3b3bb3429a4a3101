package com.whereq.orbit.controller;

import com.whereq.orbit.placement.PlacementBackendRegistry;
import com.whereq.orbit.reconcile.ReconcileWorkQueue;
import com.whereq.orbit.reconcile.ResourceLockManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller reporting the control plane's own state.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private PlacementBackendRegistry backendRegistry;

    @Autowired
    private ReconcileWorkQueue workQueue;

    @Autowired
    private ResourceLockManager lockManager;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is running and which platforms it places on")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-orbit");
            health.put("platforms", backendRegistry.platforms());

            Map<String, Object> reconcile = new HashMap<>();
            reconcile.put("pending", workQueue.size());
            reconcile.put("activeLeases", lockManager.activeLeases());
            health.put("reconcile", reconcile);

            return ResponseEntity.ok(health);
        });
    }
}
