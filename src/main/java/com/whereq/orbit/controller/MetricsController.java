package com.whereq.orbit.controller;

import com.whereq.orbit.dto.MetricReport;
import com.whereq.orbit.exception.ResourceNotFoundException;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.metrics.MetricSample;
import com.whereq.orbit.service.ResourceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Ingestion of load samples for elastic resources
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Load samples feeding the autoscaler")
public class MetricsController {

    @Autowired
    private ResourceService resourceService;

    @PostMapping("/{resourceId}")
    @Operation(summary = "Report sample", description = "Record a pressure or latency sample for an elastic resource")
    public Mono<ResponseEntity<MetricSample>> report(
            @PathVariable String resourceId,
            @Valid @RequestBody MetricReport report) {

        log.debug("Metric sample for resource {}: {}", resourceId, report.getValue());

        return resourceService.reportMetric(resourceId, report)
            .map(sample -> ResponseEntity.status(HttpStatus.ACCEPTED).body(sample))
            .onErrorResume(ResourceNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(ResourceValidationException.class, e -> {
                log.warn("Rejected metric sample for {}: {}", resourceId, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(e -> {
                log.error("Error recording metric sample for {}", resourceId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
