package com.whereq.orbit.config;

import com.whereq.orbit.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for WhereQ Orbit.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "orbit")
@Data
public class OrbitProperties {

    private StoreConfig store = new StoreConfig();

    private ReconcileConfig reconcile = new ReconcileConfig();

    private RetryPolicy retry = RetryPolicy.defaultPolicy();

    private AutoscalerConfig autoscaler = new AutoscalerConfig();

    private QueueConfig queue = new QueueConfig();

    private MetricsConfig metrics = new MetricsConfig();

    /**
     * Supported accelerators. Empty means the built-in catalog.
     */
    private List<AcceleratorConfig> accelerators = new ArrayList<>();

    private List<PlatformConfig> platforms = new ArrayList<>();

    @Data
    public static class StoreConfig {
        /**
         * Where resources are persisted.
         */
        private StoreType type = StoreType.MEMORY;

        /**
         * Key prefix for the Redis store.
         */
        private String keyPrefix = "orbit";
    }

    @Data
    public static class ReconcileConfig {
        /**
         * Number of resources reconciled in parallel.
         */
        private int workers = 4;

        /**
         * Full resync sweep interval in milliseconds.
         */
        private long resyncIntervalMs = 30000;

        /**
         * Execution locks held longer than this are reclaimed.
         */
        private Duration leaseTimeout = Duration.ofMinutes(2);

        /**
         * Re-read and retry attempts after a status write conflict.
         */
        private int conflictRetries = 5;

        /**
         * Instances whose health stays unknown for longer are treated as unhealthy.
         */
        private Duration provisioningTimeout = Duration.ofMinutes(10);

        /**
         * Delay before looking again at a resource that is waiting on a backend
         * (health, capacity, draining).
         */
        private Duration recheckInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class AutoscalerConfig {
        /**
         * Evaluation tick in milliseconds.
         */
        private long evaluationIntervalMs = 5000;

        /**
         * Samples kept per resource.
         */
        private int windowSize = 60;

        /**
         * Instances added by one scale-up action.
         */
        private int scaleUpStep = 1;

        /**
         * Instances removed by one scale-down action.
         */
        private int scaleDownStep = 1;

        /**
         * No scale action within this interval of the previous one.
         */
        private Duration minActionInterval = Duration.ofSeconds(30);

        /**
         * Draining instances are force-terminated after this long.
         */
        private Duration drainTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class QueueConfig {
        /**
         * Queue names resources may not use.
         */
        private Set<String> reservedNames = Set.of("default", "system", "orbit");
    }

    @Data
    public static class MetricsConfig {
        /**
         * Source of processor pressure.
         */
        private PressureSource pressureSource = PressureSource.REPORTED;

        /**
         * Consumer group processors read their stream with.
         */
        private String consumerGroup = "orbit-processors";
    }

    @Data
    public static class AcceleratorConfig {
        /**
         * Internal accelerator name, e.g. A100_SXM.
         */
        private String name;

        /**
         * Memory in GB.
         */
        private int memory;
    }

    @Data
    public static class PlatformConfig {
        private String name;

        private PlatformType type = PlatformType.SIMULATED;

        /**
         * Provider adapter base URL (HTTP platforms).
         */
        private String endpoint;

        /**
         * Internal accelerator name to platform-specific name.
         */
        private Map<String, String> acceleratorMap = new LinkedHashMap<>();

        /**
         * Zone to accelerator type to available count (simulated platforms).
         */
        private Map<String, Map<String, Integer>> zones = new LinkedHashMap<>();

        /**
         * Request timeout (HTTP platforms).
         */
        private Duration timeout = Duration.ofSeconds(30);
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }

    public enum PlatformType {
        /**
         * In-process platform with configured capacity, for local runs.
         */
        SIMULATED,

        /**
         * Remote provider adapter reached over HTTP.
         */
        HTTP
    }

    public enum PressureSource {
        /**
         * Pressure pushed through the metrics API.
         */
        REPORTED,

        /**
         * Pending entries of the processor's consumer group on its Redis stream.
         */
        REDIS_STREAM
    }
}
