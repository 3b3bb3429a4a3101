package com.whereq.orbit.reconcile;

import com.whereq.orbit.config.OrbitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-resource execution leases. At most one worker reconciles a resource at a time;
 * a lease older than the lease timeout is considered abandoned and can be taken over.
 */
@Slf4j
@Component
public class ResourceLockManager {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    private final Duration leaseTimeout;

    private final Clock clock;

    @Autowired
    public ResourceLockManager(OrbitProperties properties, Clock clock) {
        this(properties.getReconcile().getLeaseTimeout(), clock);
    }

    public ResourceLockManager(Duration leaseTimeout, Clock clock) {
        this.leaseTimeout = leaseTimeout;
        this.clock = clock;
    }

    /**
     * Try to take the lease of a resource
     *
     * @param resourceId resource identifier
     * @return the lease, empty if another worker holds a live lease
     */
    public Optional<Lease> tryAcquire(String resourceId) {
        Instant now = clock.instant();
        Lease lease = new Lease(resourceId, UUID.randomUUID().toString(), now);

        Lease current = leases.compute(resourceId, (id, existing) -> {
            if (existing == null) {
                return lease;
            }
            if (existing.isExpired(now, leaseTimeout)) {
                log.warn("Reclaiming lease on resource {} acquired at {}", id, existing.acquiredAt);
                return lease;
            }
            return existing;
        });

        return current == lease ? Optional.of(lease) : Optional.empty();
    }

    /**
     * Release a lease. Releasing a lease that has been reclaimed by someone else is a no-op.
     *
     * @return true if the lease was still held
     */
    public boolean release(Lease lease) {
        boolean released = leases.remove(lease.resourceId, lease);
        if (!released) {
            log.warn("Lease on resource {} was reclaimed before release", lease.resourceId);
        }
        return released;
    }

    public boolean isLocked(String resourceId) {
        Lease lease = leases.get(resourceId);
        return lease != null && !lease.isExpired(clock.instant(), leaseTimeout);
    }

    /**
     * Drop every expired lease
     *
     * @return number of leases reclaimed
     */
    public int reclaimExpired() {
        Instant now = clock.instant();
        int before = leases.size();
        leases.values().removeIf(lease -> lease.isExpired(now, leaseTimeout));
        int reclaimed = before - leases.size();
        if (reclaimed > 0) {
            log.warn("Reclaimed {} expired reconciliation leases", reclaimed);
        }
        return reclaimed;
    }

    public int activeLeases() {
        return leases.size();
    }

    /**
     * Proof of holding a resource's execution lock
     */
    public static final class Lease {
        private final String resourceId;
        private final String token;
        private final Instant acquiredAt;

        Lease(String resourceId, String token, Instant acquiredAt) {
            this.resourceId = resourceId;
            this.token = token;
            this.acquiredAt = acquiredAt;
        }

        public String getResourceId() {
            return resourceId;
        }

        boolean isExpired(Instant now, Duration timeout) {
            return !acquiredAt.plus(timeout).isAfter(now);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Lease)) {
                return false;
            }
            return token.equals(((Lease) o).token);
        }

        @Override
        public int hashCode() {
            return token.hashCode();
        }
    }
}
