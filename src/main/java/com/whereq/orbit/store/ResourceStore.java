package com.whereq.orbit.store;

import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourceEvent;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.StatusEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable, versioned record of desired specs and observed status.
 * <p>
 * Status writes use optimistic concurrency on {@link Resource#getResourceVersion()}:
 * a {@link com.whereq.orbit.exception.ResourceConflictException} means the caller must
 * re-read and retry.
 * </p>
 */
public interface ResourceStore {

    /**
     * Get a resource
     *
     * @param id resource identifier
     * @return Mono with the resource, erroring with ResourceNotFoundException if absent
     */
    Mono<Resource> get(String id);

    /**
     * List resources matching a filter, in creation order
     *
     * @param filter the filter
     * @return Flux of matching resources
     */
    Flux<Resource> list(ResourceFilter filter);

    /**
     * Create a resource or replace the spec of an existing one with the same
     * (owner, namespace, name), bumping its generation
     *
     * @param draft desired spec with identity
     * @return Mono with the stored resource
     */
    Mono<Resource> putSpec(ResourceDraft draft);

    /**
     * Replace the status of a resource
     *
     * @param id resource identifier
     * @param status new status
     * @param expectedVersion resource version the status was computed from
     * @return Mono with the stored resource, erroring with ResourceConflictException on a version mismatch
     */
    Mono<Resource> updateStatus(String id, ResourceStatus status, long expectedVersion);

    /**
     * Request deletion: marks the resource as deleted and moves it to TERMINATING
     *
     * @param id resource identifier
     * @return Mono with the stored resource
     */
    Mono<Resource> delete(String id);

    /**
     * Status history of a resource, oldest first
     *
     * @param id resource identifier
     * @return Flux of status events
     */
    Flux<StatusEvent> history(String id);

    /**
     * Hot stream of write notifications made through this store instance
     *
     * @return Flux of resource events
     */
    Flux<ResourceEvent> changes();
}
