package com.whereq.orbit.placement;

import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for a cloud platform able to run instances.
 * Failures surface as {@link com.whereq.orbit.exception.BackendException}.
 */
public interface PlacementBackend {

    /**
     * Platform name, as referenced by resource specs
     */
    String platform();

    /**
     * Check if the platform offers an accelerator type
     *
     * @param acceleratorType internal accelerator name, null for CPU-only placement
     */
    boolean supports(String acceleratorType);

    /**
     * Query currently available capacity per zone
     *
     * @param acceleratorType internal accelerator name, null for CPU-only placement
     * @return Mono with the capacity report
     */
    Mono<CapacityReport> queryCapacity(String acceleratorType);

    /**
     * Provision instances in one zone
     *
     * @param request what to run and where
     * @return Mono with the created instances, in creation order
     */
    Mono<List<Instance>> provision(ProvisionRequest request);

    /**
     * Terminate an instance. Terminating an unknown instance is not an error.
     *
     * @param instanceId instance identifier
     */
    Mono<Void> terminate(String instanceId);

    /**
     * Check the health of an instance
     *
     * @param instanceId instance identifier
     * @return Mono with the health status
     */
    Mono<HealthStatus> healthCheck(String instanceId);

    /**
     * Units of work an instance is still processing, used to finish draining early
     *
     * @param instanceId instance identifier
     * @return Mono with the in-flight count
     */
    default Mono<Integer> inFlight(String instanceId) {
        // Default: nothing to wait for
        return Mono.just(0);
    }
}
