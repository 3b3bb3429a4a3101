package com.whereq.orbit.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.config.OrbitProperties;
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
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Redis-backed resource store.
 * <p>
 * Each resource is a JSON document under {@code {prefix}:resource:{id}}. Writes go through
 * a Lua compare-and-set on {@code resourceVersion} that also appends the status event to
 * {@code {prefix}:resource:{id}:events}, so a record and its history never diverge.
 * </p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "orbit.store", name = "type", havingValue = "redis")
public class RedisResourceStore implements ResourceStore {

    /**
     * Returns -1 when the record is missing, 0 on a version mismatch, 1 when written.
     * An expected version of 0 means "create if absent".
     */
    private static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
        "local current = redis.call('GET', KEYS[1]) "
            + "local expected = tonumber(ARGV[1]) "
            + "if not current then "
            + "  if expected ~= 0 then return -1 end "
            + "else "
            + "  if tonumber(cjson.decode(current)['resourceVersion']) ~= expected then return 0 end "
            + "end "
            + "redis.call('SET', KEYS[1], ARGV[2]) "
            + "redis.call('RPUSH', KEYS[2], ARGV[3]) "
            + "redis.call('SADD', KEYS[3], ARGV[4]) "
            + "return 1",
        Long.class);

    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    private final ObjectMapper objectMapper;

    private final Clock clock;

    private final String prefix;

    private final Sinks.Many<ResourceEvent> changes = Sinks.many().multicast().directBestEffort();

    @Autowired
    public RedisResourceStore(ReactiveRedisTemplate<String, String> redisTemplate,
                              ObjectMapper objectMapper,
                              Clock clock,
                              OrbitProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.prefix = properties.getStore().getKeyPrefix();
    }

    @Override
    public Mono<Resource> get(String id) {
        return redisTemplate.opsForValue()
            .get(resourceKey(id))
            .map(this::deserialize)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Resource not found: " + id)));
    }

    @Override
    public Flux<Resource> list(ResourceFilter filter) {
        return redisTemplate.opsForSet()
            .members(idsKey())
            .flatMap(id -> redisTemplate.opsForValue().get(resourceKey(id)))
            .map(this::deserialize)
            .filter(filter::matches)
            .sort((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
    }

    @Override
    public Mono<Resource> putSpec(ResourceDraft draft) {
        String nameKey = ResourceRecords.nameKey(draft);

        return Mono.defer(() -> redisTemplate.opsForHash()
                .get(namesKey(), nameKey)
                .map(Object::toString)
                .flatMap(id -> get(id).onErrorResume(ResourceNotFoundException.class, e -> Mono.empty()))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isPresent() && ResourceRecords.claimsName(found.get())) {
                        Resource existing = found.get();
                        if (existing.isDeletionRequested()) {
                            return Mono.error(new DuplicateResourceException(existing.displayName() + " is being deleted"));
                        }
                        Resource updated = ResourceRecords.respec(existing, draft, clock.instant());
                        return write(updated, existing.getResourceVersion(), ResourceEvent.Type.SPEC_UPDATED);
                    }
                    return create(draft, nameKey, found.isPresent());
                }))
            .retryWhen(conflictRetry())
            .doOnSuccess(resource -> log.info("Resource {} ({}) stored at generation {}",
                resource.getId(), resource.displayName(), resource.getGeneration()));
    }

    @Override
    public Mono<Resource> updateStatus(String id, ResourceStatus status, long expectedVersion) {
        return get(id)
            .flatMap(existing -> {
                if (existing.getResourceVersion() != expectedVersion) {
                    return Mono.error(new ResourceConflictException(String.format(
                        "Resource %s is at version %d, expected %d", id, existing.getResourceVersion(), expectedVersion)));
                }
                return write(ResourceRecords.withStatus(existing, status), expectedVersion,
                    ResourceEvent.Type.STATUS_UPDATED);
            });
    }

    @Override
    public Mono<Resource> delete(String id) {
        return modify(id, existing -> existing.isDeletionRequested()
                ? null
                : ResourceRecords.markDeleted(existing, clock.instant()),
            ResourceEvent.Type.DELETED)
            .doOnSuccess(resource -> log.info("Resource {} marked for deletion", id));
    }

    @Override
    public Flux<StatusEvent> history(String id) {
        return get(id).thenMany(redisTemplate.opsForList()
            .range(eventsKey(id), 0, -1)
            .map(json -> {
                try {
                    return objectMapper.readValue(json, StatusEvent.class);
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Corrupt status event for resource " + id, e);
                }
            }));
    }

    @Override
    public Flux<ResourceEvent> changes() {
        return changes.asFlux();
    }

    /**
     * Claim the name and write the first version. A stale claim left by a terminated
     * resource is overwritten, a live concurrent claim is a conflict.
     */
    private Mono<Resource> create(ResourceDraft draft, String nameKey, boolean replaceStaleClaim) {
        Resource created = ResourceRecords.create(draft, clock.instant());
        Mono<Boolean> claim = replaceStaleClaim
            ? redisTemplate.opsForHash().put(namesKey(), nameKey, created.getId())
            : redisTemplate.opsForHash().putIfAbsent(namesKey(), nameKey, created.getId());

        return claim.flatMap(claimed -> claimed || replaceStaleClaim
            ? write(created, 0, ResourceEvent.Type.CREATED)
            : Mono.error(new ResourceConflictException("Concurrent create of " + nameKey)));
    }

    /**
     * Read-modify-write with re-read on conflict; a null result from the function means no change
     */
    private Mono<Resource> modify(String id, Function<Resource, Resource> change, ResourceEvent.Type type) {
        return Mono.defer(() -> get(id)
                .flatMap(existing -> {
                    Resource updated = change.apply(existing);
                    return updated == null
                        ? Mono.just(existing)
                        : write(updated, existing.getResourceVersion(), type);
                }))
            .retryWhen(conflictRetry());
    }

    private Mono<Resource> write(Resource resource, long expectedVersion, ResourceEvent.Type type) {
        return Mono.fromCallable(() -> List.of(
                String.valueOf(expectedVersion),
                objectMapper.writeValueAsString(resource),
                objectMapper.writeValueAsString(ResourceRecords.event(resource, resource.getResourceVersion(), clock.instant())),
                resource.getId()))
            .flatMap(args -> redisTemplate
                .execute(COMPARE_AND_SET, List.of(resourceKey(resource.getId()), eventsKey(resource.getId()), idsKey()), args)
                .next())
            .flatMap(result -> {
                if (result == 1L) {
                    Sinks.EmitResult emitted = changes.tryEmitNext(
                        new ResourceEvent(resource.getId(), type, resource.getResourceVersion()));
                    if (emitted.isFailure() && emitted != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                        log.debug("Change event for {} not published: {}", resource.getId(), emitted);
                    }
                    return Mono.just(resource);
                }
                if (result == 0L) {
                    return Mono.error(new ResourceConflictException(
                        "Concurrent write to resource " + resource.getId()));
                }
                return Mono.error(new ResourceNotFoundException("Resource not found: " + resource.getId()));
            });
    }

    private Retry conflictRetry() {
        return Retry.backoff(MAX_WRITE_ATTEMPTS, Duration.ofMillis(20))
            .filter(ResourceConflictException.class::isInstance)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private Resource deserialize(String json) {
        try {
            return objectMapper.readValue(json, Resource.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt resource record", e);
        }
    }

    private String resourceKey(String id) {
        return prefix + ":resource:" + id;
    }

    private String eventsKey(String id) {
        return prefix + ":resource:" + id + ":events";
    }

    private String idsKey() {
        return prefix + ":resources";
    }

    private String namesKey() {
        return prefix + ":resource-names";
    }
}
