package com.whereq.orbit.placement;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.BackendException;
import com.whereq.orbit.exception.ProvisioningException;
import com.whereq.orbit.model.HealthStatus;
import com.whereq.orbit.model.Instance;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Platform reached through a provider adapter speaking JSON over HTTP.
 * <p>
 * Endpoints, relative to the configured base URL:
 * <ul>
 *   <li>{@code GET /capacity?accelerator=} → {@code {"available": {zone: count}}}</li>
 *   <li>{@code POST /instances} → list of instances</li>
 *   <li>{@code DELETE /instances/{id}}</li>
 *   <li>{@code GET /instances/{id}/health} → {@code {"status": "HEALTHY"}}</li>
 *   <li>{@code GET /instances/{id}/in-flight} → {@code {"count": 0}}</li>
 * </ul>
 * Accelerator names are translated with the platform's accelerator map.
 * </p>
 */
@Slf4j
public class HttpPlacementBackend implements PlacementBackend {

    private static final ParameterizedTypeReference<List<Instance>> INSTANCE_LIST =
        new ParameterizedTypeReference<>() {};

    private final String platform;

    private final Map<String, String> acceleratorMap;

    private final Duration timeout;

    private final WebClient webClient;

    public HttpPlacementBackend(OrbitProperties.PlatformConfig config, WebClient.Builder webClientBuilder) {
        this.platform = config.getName();
        this.acceleratorMap = Map.copyOf(config.getAcceleratorMap());
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getEndpoint())
            .build();
        log.info("HTTP platform {} initialized with endpoint {}", platform, config.getEndpoint());
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public boolean supports(String acceleratorType) {
        return acceleratorType == null || acceleratorMap.containsKey(acceleratorType);
    }

    @Override
    public Mono<CapacityReport> queryCapacity(String acceleratorType) {
        String platformType = platformName(acceleratorType);
        return webClient.get()
            .uri(uri -> uri.path("/capacity").queryParam("accelerator", platformType).build())
            .retrieve()
            .bodyToMono(CapacityResponse.class)
            .timeout(timeout)
            .map(response -> CapacityReport.builder()
                .platform(platform)
                .acceleratorType(acceleratorType == null ? CapacityReport.CPU : acceleratorType)
                .available(response.getAvailable() == null ? Map.of() : response.getAvailable())
                .build())
            .onErrorMap(e -> !(e instanceof BackendException),
                e -> new BackendException("Capacity query failed on " + platform + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<List<Instance>> provision(ProvisionRequest request) {
        ProvisionRequest translated = request.getAllocation().isNone()
            ? request
            : request.toBuilder()
                .platformAcceleratorType(platformName(request.getAllocation().getType()))
                .build();

        return webClient.post()
            .uri("/instances")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(translated)
            .retrieve()
            .bodyToMono(INSTANCE_LIST)
            .timeout(timeout)
            .doOnSuccess(instances -> log.info("Provisioned {} instances of {} on {}/{}",
                instances == null ? 0 : instances.size(), request.getResourceName(), platform, request.getZone()))
            .onErrorMap(e -> !(e instanceof ProvisioningException),
                e -> new ProvisioningException("Provisioning failed on " + platform + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<Void> terminate(String instanceId) {
        return webClient.delete()
            .uri("/instances/{id}", instanceId)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.info("Terminated instance {} on {}", instanceId, platform))
            .onErrorMap(e -> !(e instanceof BackendException),
                e -> new BackendException("Termination of " + instanceId + " failed on " + platform, e))
            .then();
    }

    @Override
    public Mono<HealthStatus> healthCheck(String instanceId) {
        return webClient.get()
            .uri("/instances/{id}/health", instanceId)
            .retrieve()
            .bodyToMono(HealthResponse.class)
            .timeout(timeout)
            .map(response -> response.getStatus() == null ? HealthStatus.UNKNOWN : response.getStatus())
            .onErrorMap(e -> !(e instanceof BackendException),
                e -> new BackendException("Health check of " + instanceId + " failed on " + platform, e));
    }

    @Override
    public Mono<Integer> inFlight(String instanceId) {
        return webClient.get()
            .uri("/instances/{id}/in-flight", instanceId)
            .retrieve()
            .bodyToMono(InFlightResponse.class)
            .timeout(timeout)
            .map(InFlightResponse::getCount)
            .onErrorMap(e -> !(e instanceof BackendException),
                e -> new BackendException("In-flight query of " + instanceId + " failed on " + platform, e));
    }

    private String platformName(String acceleratorType) {
        if (acceleratorType == null) {
            return CapacityReport.CPU;
        }
        return acceleratorMap.getOrDefault(acceleratorType, acceleratorType);
    }

    @Data
    static class CapacityResponse {
        private Map<String, Integer> available = new LinkedHashMap<>();
    }

    @Data
    static class HealthResponse {
        private HealthStatus status;
    }

    @Data
    static class InFlightResponse {
        private int count;
    }
}
