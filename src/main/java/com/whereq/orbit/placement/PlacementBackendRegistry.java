package com.whereq.orbit.placement;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ResourceValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of placement backends by platform name, built from {@code orbit.platforms}
 */
@Slf4j
@Component
public class PlacementBackendRegistry {

    private final Map<String, PlacementBackend> backends;

    @Autowired
    public PlacementBackendRegistry(OrbitProperties properties,
                                    @Qualifier("placementWebClientBuilder") WebClient.Builder webClientBuilder,
                                    Clock clock) {
        this(create(properties.getPlatforms(), webClientBuilder, clock));
    }

    public PlacementBackendRegistry(List<? extends PlacementBackend> backends) {
        Map<String, PlacementBackend> byName = new LinkedHashMap<>();
        for (PlacementBackend backend : backends) {
            if (byName.putIfAbsent(backend.platform(), backend) != null) {
                throw new IllegalStateException("Platform configured twice: " + backend.platform());
            }
        }
        this.backends = Collections.unmodifiableMap(byName);
        log.info("Placement backends registered: {}", this.backends.keySet());
    }

    public Optional<PlacementBackend> get(String platform) {
        return Optional.ofNullable(backends.get(platform));
    }

    /**
     * Get the backend of a platform named by a resource spec
     *
     * @throws ResourceValidationException if no such platform is configured
     */
    public PlacementBackend require(String platform) {
        PlacementBackend backend = backends.get(platform);
        if (backend == null) {
            throw new ResourceValidationException("Unknown platform: " + platform);
        }
        return backend;
    }

    /**
     * All backends in configuration order
     */
    public List<PlacementBackend> all() {
        return new ArrayList<>(backends.values());
    }

    public List<String> platforms() {
        return new ArrayList<>(backends.keySet());
    }

    private static List<PlacementBackend> create(List<OrbitProperties.PlatformConfig> platforms,
                                                 WebClient.Builder webClientBuilder, Clock clock) {
        List<PlacementBackend> created = new ArrayList<>();
        for (OrbitProperties.PlatformConfig platform : platforms) {
            switch (platform.getType()) {
                case SIMULATED -> created.add(new SimulatedPlacementBackend(platform, clock));
                case HTTP -> {
                    if (platform.getEndpoint() == null || platform.getEndpoint().isBlank()) {
                        throw new IllegalStateException("Platform " + platform.getName() + " requires an endpoint");
                    }
                    created.add(new HttpPlacementBackend(platform, webClientBuilder));
                }
            }
        }
        return created;
    }
}
