package com.whereq.orbit.store;

import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.StatusEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Record transitions shared by the store implementations
 */
final class ResourceRecords {

    private ResourceRecords() {
    }

    static String newId() {
        return "res-" + UUID.randomUUID();
    }

    static String nameKey(String owner, String namespace, String name) {
        return owner + "/" + namespace + "/" + name;
    }

    static String nameKey(ResourceDraft draft) {
        return nameKey(draft.getOwner(), draft.getNamespace(), draft.getName());
    }

    static String nameKey(Resource resource) {
        return nameKey(resource.getOwner(), resource.getNamespace(), resource.getName());
    }

    /**
     * Check if an existing record still claims its name
     */
    static boolean claimsName(Resource existing) {
        return !(existing.isDeletionRequested() && existing.phase().isTerminal());
    }

    static Resource create(ResourceDraft draft, Instant now) {
        return Resource.builder()
            .id(newId())
            .name(draft.getName())
            .namespace(draft.getNamespace())
            .owner(draft.getOwner())
            .kind(draft.getKind())
            .spec(draft.getSpec())
            .status(ResourceStatus.pending(now))
            .generation(1)
            .resourceVersion(1)
            .createdAt(now)
            .build();
    }

    /**
     * New generation of an existing resource. The phase is left to the reconciler,
     * except that a failed resource gets another chance.
     */
    static Resource respec(Resource existing, ResourceDraft draft, Instant now) {
        if (existing.getKind() != draft.getKind()) {
            throw new ResourceValidationException("Cannot change kind of " + existing.displayName()
                + " from " + existing.getKind() + " to " + draft.getKind());
        }

        ResourceStatus status = existing.getStatus();
        if (status.getPhase() == ResourcePhase.FAILED) {
            status = status.toBuilder()
                .phase(ResourcePhase.PENDING)
                .retryCount(0)
                .nextAttemptAt(null)
                .startedAt(null)
                .lastTransitionTime(now)
                .message("Spec updated")
                .build();
        }

        return existing.toBuilder()
            .spec(draft.getSpec())
            .status(status)
            .generation(existing.getGeneration() + 1)
            .resourceVersion(existing.getResourceVersion() + 1)
            .build();
    }

    static Resource withStatus(Resource existing, ResourceStatus status) {
        return existing.toBuilder()
            .status(status)
            .resourceVersion(existing.getResourceVersion() + 1)
            .build();
    }

    static Resource markDeleted(Resource existing, Instant now) {
        ResourceStatus status = existing.getStatus();
        if (!status.getPhase().isTerminal() && status.getPhase() != ResourcePhase.TERMINATING) {
            status = status.toBuilder()
                .phase(ResourcePhase.TERMINATING)
                .lastTransitionTime(now)
                .message("Deletion requested")
                .build();
        }
        return existing.toBuilder()
            .deletionRequested(true)
            .status(status)
            .resourceVersion(existing.getResourceVersion() + 1)
            .build();
    }

    static StatusEvent event(Resource resource, long sequence, Instant now) {
        ResourceStatus status = resource.getStatus();
        return StatusEvent.builder()
            .resourceId(resource.getId())
            .sequence(sequence)
            .phase(status.getPhase())
            .message(status.getMessage())
            .instanceCount(status.activeInstances().size())
            .resourceVersion(resource.getResourceVersion())
            .timestamp(now)
            .build();
    }
}
