package com.whereq.orbit.resource;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.model.AcceleratorRequest;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourceSpec;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.model.ScaleRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates desired specs before any placement is attempted
 */
@Slf4j
@Component
public class SpecValidator {

    private static final Pattern QUEUE_NAME_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]{0,62}");

    private final AcceleratorCatalog acceleratorCatalog;

    private final Set<String> reservedQueueNames;

    @Autowired
    public SpecValidator(AcceleratorCatalog acceleratorCatalog, OrbitProperties properties) {
        this(acceleratorCatalog, properties.getQueue().getReservedNames());
    }

    public SpecValidator(AcceleratorCatalog acceleratorCatalog, Set<String> reservedQueueNames) {
        this.acceleratorCatalog = acceleratorCatalog;
        this.reservedQueueNames = reservedQueueNames;
    }

    /**
     * Validate the spec of a resource
     *
     * @param resource the resource
     * @throws ResourceValidationException describing the first problem found
     */
    public void validate(Resource resource) {
        ResourceSpec spec = resource.getSpec();
        if (spec == null) {
            throw new ResourceValidationException("Spec is required");
        }
        if (spec.getImage() == null || spec.getImage().isBlank()) {
            throw new ResourceValidationException("Image is required");
        }

        validatePayload(resource);
        List<AcceleratorRequest> options = acceleratorCatalog.parseAll(spec.getAccelerators());
        if (spec.getCluster() != null) {
            validateClusterSize(options, spec.getCluster().getNumNodes());
        }

        if (spec.getQueue() != null) {
            validateQueueName(spec.getQueue());
        }
        if (spec.getTimeout() != null) {
            validateTimeout(resource);
        }

        if (resource.isElastic()) {
            validateBounds(resource);
            validateScalePolicy(resource.scalePolicy());
        }
    }

    /**
     * Validate a queue name against the naming rules and reserved names
     */
    public void validateQueueName(String queue) {
        if (!QUEUE_NAME_PATTERN.matcher(queue).matches()) {
            throw new ResourceValidationException(
                "Invalid queue name '" + queue + "': lowercase letters, digits and '-' only, max 63 chars");
        }
        if (reservedQueueNames.contains(queue)) {
            throw new ResourceValidationException("Queue name '" + queue + "' is reserved");
        }
    }

    private void validatePayload(Resource resource) {
        ResourceSpec spec = resource.getSpec();
        int payloads = (spec.getProcessor() != null ? 1 : 0)
            + (spec.getService() != null ? 1 : 0)
            + (spec.getCluster() != null ? 1 : 0);
        if (payloads > 1) {
            throw new ResourceValidationException("Spec carries more than one kind payload");
        }

        switch (resource.getKind()) {
            case CONTAINER -> {
                if (payloads != 0) {
                    throw new ResourceValidationException("Container spec must not carry a kind payload");
                }
            }
            case PROCESSOR -> {
                if (spec.getProcessor() == null) {
                    throw new ResourceValidationException("Processor spec is required");
                }
                if (spec.getProcessor().getStream() == null || spec.getProcessor().getStream().isBlank()) {
                    throw new ResourceValidationException("Processor stream is required");
                }
            }
            case SERVICE -> {
                if (spec.getProcessor() != null || spec.getCluster() != null) {
                    throw new ResourceValidationException("Service spec carries a foreign kind payload");
                }
            }
            case CLUSTER -> {
                if (spec.getCluster() == null || spec.getCluster().getNumNodes() < 1) {
                    throw new ResourceValidationException("Cluster requires at least one node");
                }
            }
        }
    }

    private void validateTimeout(Resource resource) {
        if (resource.getKind() != ResourceKind.CONTAINER) {
            throw new ResourceValidationException("Timeout is only supported for containers");
        }
        if (DurationParser.parse(resource.getSpec().getTimeout()).isZero()) {
            throw new ResourceValidationException("Timeout must be longer than zero");
        }
    }

    private void validateClusterSize(List<AcceleratorRequest> options, int numNodes) {
        for (AcceleratorRequest option : options) {
            try {
                Math.multiplyExact(Math.max(1, option.getCount()), numNodes);
            } catch (ArithmeticException e) {
                throw new ResourceValidationException(
                    "Cluster of " + numNodes + " nodes with " + option + " is too large", e);
            }
        }
    }

    private void validateBounds(Resource resource) {
        ResourceSpec spec = resource.getSpec();
        Integer min = resource.getKind() == ResourceKind.PROCESSOR
            ? spec.getProcessor().getMinReplicas()
            : spec.getService() == null ? null : spec.getService().getMinContainers();
        Integer max = resource.getKind() == ResourceKind.PROCESSOR
            ? spec.getProcessor().getMaxReplicas()
            : spec.getService() == null ? null : spec.getService().getMaxContainers();

        if (min != null && min < 0) {
            throw new ResourceValidationException("Minimum instances must not be negative");
        }
        if (max != null && max < 1) {
            throw new ResourceValidationException("Maximum instances must be at least 1");
        }
        if (min != null && max != null && min > max) {
            throw new ResourceValidationException("Minimum instances exceed maximum instances");
        }
    }

    private void validateScalePolicy(ScalePolicy policy) {
        if (policy == null) {
            return;
        }
        validateRule("up", policy.getUp(), true);
        validateRule("down", policy.getDown(), true);
        validateRule("zero", policy.getZero(), false);

        if (policy.getUp() != null && policy.getDown() != null
            && policy.getDown().getThreshold() > policy.getUp().getThreshold()) {
            throw new ResourceValidationException("Scale-down threshold is above the scale-up threshold");
        }
    }

    private void validateRule(String name, ScaleRule rule, boolean thresholdRequired) {
        if (rule == null) {
            return;
        }
        if (thresholdRequired && rule.getThreshold() == null) {
            throw new ResourceValidationException("Scale rule '" + name + "' requires a threshold");
        }
        if (rule.getThreshold() != null && rule.getThreshold() < 0) {
            throw new ResourceValidationException("Scale rule '" + name + "' threshold must not be negative");
        }
        DurationParser.parse(rule.getDuration());
    }
}
