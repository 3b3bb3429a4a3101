package com.whereq.orbit.store;

import com.whereq.orbit.exception.DuplicateResourceException;
import com.whereq.orbit.exception.ResourceConflictException;
import com.whereq.orbit.exception.ResourceNotFoundException;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourceEvent;
import com.whereq.orbit.model.ResourceFilter;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.StatusEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process resource store. Writes are serialized on the store monitor,
 * reads see the latest committed record.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "orbit.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryResourceStore implements ResourceStore {

    private final Clock clock;

    // Insertion-ordered so list() returns creation order
    private final Map<String, Resource> resources = new LinkedHashMap<>();

    private final Map<String, String> idsByName = new ConcurrentHashMap<>();

    private final Map<String, List<StatusEvent>> history = new ConcurrentHashMap<>();

    private final Sinks.Many<ResourceEvent> changes = Sinks.many().multicast().directBestEffort();

    @Autowired
    public InMemoryResourceStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Resource> get(String id) {
        return Mono.defer(() -> {
            Resource resource;
            synchronized (this) {
                resource = resources.get(id);
            }
            return resource == null
                ? Mono.error(new ResourceNotFoundException("Resource not found: " + id))
                : Mono.just(resource);
        });
    }

    @Override
    public Flux<Resource> list(ResourceFilter filter) {
        return Flux.defer(() -> {
            List<Resource> snapshot;
            synchronized (this) {
                snapshot = new ArrayList<>(resources.values());
            }
            return Flux.fromIterable(snapshot).filter(filter::matches);
        });
    }

    @Override
    public Mono<Resource> putSpec(ResourceDraft draft) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Instant now = clock.instant();
                String nameKey = ResourceRecords.nameKey(draft);
                String existingId = idsByName.get(nameKey);
                Resource existing = existingId == null ? null : resources.get(existingId);

                if (existing != null && ResourceRecords.claimsName(existing)) {
                    if (existing.isDeletionRequested()) {
                        throw new DuplicateResourceException(existing.displayName() + " is being deleted");
                    }
                    Resource updated = ResourceRecords.respec(existing, draft, now);
                    commit(updated, ResourceEvent.Type.SPEC_UPDATED, now);
                    log.info("Resource {} ({}) spec updated to generation {}",
                        updated.getId(), updated.displayName(), updated.getGeneration());
                    return updated;
                }

                Resource created = ResourceRecords.create(draft, now);
                idsByName.put(nameKey, created.getId());
                commit(created, ResourceEvent.Type.CREATED, now);
                log.info("Resource {} ({}) created, kind={}", created.getId(), created.displayName(), created.getKind());
                return created;
            }
        });
    }

    @Override
    public Mono<Resource> updateStatus(String id, ResourceStatus status, long expectedVersion) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Resource existing = require(id);
                if (existing.getResourceVersion() != expectedVersion) {
                    throw new ResourceConflictException(String.format(
                        "Resource %s is at version %d, expected %d", id, existing.getResourceVersion(), expectedVersion));
                }
                Resource updated = ResourceRecords.withStatus(existing, status);
                commit(updated, ResourceEvent.Type.STATUS_UPDATED, clock.instant());
                return updated;
            }
        });
    }

    @Override
    public Mono<Resource> delete(String id) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Resource existing = require(id);
                if (existing.isDeletionRequested()) {
                    return existing;
                }
                Resource updated = ResourceRecords.markDeleted(existing, clock.instant());
                commit(updated, ResourceEvent.Type.DELETED, clock.instant());
                log.info("Resource {} ({}) marked for deletion", id, existing.displayName());
                return updated;
            }
        });
    }

    @Override
    public Flux<StatusEvent> history(String id) {
        return get(id).flatMapMany(resource -> {
            List<StatusEvent> events = history.getOrDefault(id, List.of());
            synchronized (events) {
                return Flux.fromIterable(new ArrayList<>(events));
            }
        });
    }

    @Override
    public Flux<ResourceEvent> changes() {
        return changes.asFlux();
    }

    private Resource require(String id) {
        Resource resource = resources.get(id);
        if (resource == null) {
            throw new ResourceNotFoundException("Resource not found: " + id);
        }
        return resource;
    }

    private void commit(Resource resource, ResourceEvent.Type type, Instant now) {
        resources.put(resource.getId(), resource);
        List<StatusEvent> events = history.computeIfAbsent(resource.getId(), k -> new ArrayList<>());
        synchronized (events) {
            events.add(ResourceRecords.event(resource, events.size() + 1, now));
        }

        Sinks.EmitResult result = changes.tryEmitNext(
            new ResourceEvent(resource.getId(), type, resource.getResourceVersion()));
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to publish {} event for resource {}: {}", type, resource.getId(), result);
        }
    }
}
