package com.whereq.orbit.controller;

import com.whereq.orbit.autoscale.AutoscalerSnapshot;
import com.whereq.orbit.dto.ResourceRequest;
import com.whereq.orbit.dto.ResourceResponse;
import com.whereq.orbit.exception.DuplicateResourceException;
import com.whereq.orbit.exception.ResourceConflictException;
import com.whereq.orbit.exception.ResourceNotFoundException;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.StatusEvent;
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

import java.net.URI;
import java.util.List;

/**
 * Management API for resources. Writes only change the desired state; the
 * reconciliation loop converges the observed state afterwards.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/resources")
@Tag(name = "Resources", description = "Declarative resource management")
public class ResourceController {

    static final String OWNER_HEADER = "X-Orbit-Owner";

    @Autowired
    private ResourceService resourceService;

    /**
     * Submit a resource
     *
     * @param request desired state
     * @param ownerHeader tenant submitting the request
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Create resource", description = "Store the desired state of a new resource")
    public Mono<ResponseEntity<ResourceResponse>> create(
            @Valid @RequestBody ResourceRequest request,
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerHeader) {

        String owner = owner(ownerHeader);

        log.info("Received resource submission from {}: name={}, kind={}",
            owner, request.getName(), request.getKind());

        return resourceService.create(request, owner)
            .map(resource -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/resources/" + resource.getId()))
                .body(ResourceResponse.from(resource)))
            .onErrorResume(e -> Mono.just(errorResponse("submitting resource " + request.getName(), e)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update resource", description = "Replace the spec, bumping the generation")
    public Mono<ResponseEntity<ResourceResponse>> update(
            @PathVariable String id,
            @Valid @RequestBody ResourceRequest request) {

        log.info("Received spec update for resource {}", id);

        return resourceService.update(id, request)
            .map(resource -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(ResourceResponse.from(resource)))
            .onErrorResume(e -> Mono.just(errorResponse("updating resource " + id, e)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get resource", description = "Spec and observed status of a resource")
    public Mono<ResponseEntity<ResourceResponse>> get(@PathVariable String id) {
        return resourceService.get(id)
            .map(resource -> ResponseEntity.ok(ResourceResponse.from(resource)))
            .onErrorResume(e -> Mono.just(errorResponse("reading resource " + id, e)));
    }

    @GetMapping
    @Operation(summary = "List resources", description = "Resources matching the given filters")
    public Mono<ResponseEntity<List<ResourceResponse>>> list(
            @RequestParam(required = false) String owner,
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) ResourceKind kind,
            @RequestParam(required = false) ResourcePhase phase,
            @RequestParam(required = false) String queue) {

        ResourceFilter filter = ResourceFilter.builder()
            .owner(owner)
            .namespace(namespace)
            .kind(kind)
            .phase(phase)
            .queue(queue)
            .build();

        return resourceService.list(filter)
            .map(ResourceResponse::from)
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Error listing resources", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    /**
     * Request deletion of a resource
     *
     * @param id resource identifier
     * @return Mono with 202 Accepted response; instances are drained and terminated asynchronously
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "Delete resource", description = "Drain and terminate all instances of a resource")
    public Mono<ResponseEntity<ResourceResponse>> delete(@PathVariable String id) {
        log.info("Deletion request for resource {}", id);

        return resourceService.delete(id)
            .map(resource -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(ResourceResponse.from(resource)))
            .onErrorResume(e -> Mono.just(errorResponse("deleting resource " + id, e)));
    }

    @GetMapping("/{id}/events")
    @Operation(summary = "Status history", description = "Status writes of a resource, oldest first")
    public Mono<ResponseEntity<List<StatusEvent>>> events(@PathVariable String id) {
        return resourceService.history(id)
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(ResourceNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(e -> {
                log.error("Error reading history of resource {}", id, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/{id}/autoscaler")
    @Operation(summary = "Autoscaler state", description = "Sample window and scaling timers of an elastic resource")
    public Mono<ResponseEntity<AutoscalerSnapshot>> autoscaler(@PathVariable String id) {
        return resourceService.autoscaler(id)
            .map(ResponseEntity::ok)
            .switchIfEmpty(Mono.just(ResponseEntity.noContent().build()))
            .onErrorResume(ResourceNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(e -> {
                log.error("Error reading autoscaler state of resource {}", id, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    private ResponseEntity<ResourceResponse> errorResponse(String action, Throwable e) {
        HttpStatus status;
        if (e instanceof ResourceValidationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof ResourceNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof DuplicateResourceException || e instanceof ResourceConflictException) {
            status = HttpStatus.CONFLICT;
        } else {
            log.error("Unexpected error {}", action, e);
            return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ResourceResponse.error("Internal server error: " + e.getMessage()));
        }

        log.warn("Rejected {}: {}", action, e.getMessage());
        return ResponseEntity.status(status).body(ResourceResponse.error(e.getMessage()));
    }

    /**
     * Tenant of the caller; requests without the header belong to "anonymous"
     */
    static String owner(String ownerHeader) {
        return ownerHeader == null || ownerHeader.isBlank() ? "anonymous" : ownerHeader;
    }
}
