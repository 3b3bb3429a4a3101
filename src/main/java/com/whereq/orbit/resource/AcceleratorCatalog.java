package com.whereq.orbit.resource;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ResourceValidationException;
import com.whereq.orbit.model.AcceleratorRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Supported accelerator types and the {@code count:TYPE} request syntax
 */
@Slf4j
@Component
public class AcceleratorCatalog {

    private static final Pattern ACCELERATOR_PATTERN = Pattern.compile("(\\d+):([A-Za-z0-9_]+)");

    /**
     * Most accelerators of one type a single node can carry
     */
    public static final int MAX_PER_NODE = 64;

    private static final Map<String, Integer> DEFAULT_ACCELERATORS = defaults();

    /**
     * Accelerator name to memory in GB
     */
    private final Map<String, Integer> supported;

    @Autowired
    public AcceleratorCatalog(OrbitProperties properties) {
        this(toMap(properties.getAccelerators()));
    }

    public AcceleratorCatalog(Map<String, Integer> supported) {
        this.supported = supported.isEmpty()
            ? DEFAULT_ACCELERATORS
            : Collections.unmodifiableMap(new LinkedHashMap<>(supported));
        log.info("Accelerator catalog initialized with {} types", this.supported.size());
    }

    /**
     * Parse an accelerator option (e.g. "2:A100_SXM")
     *
     * @param value accelerator string
     * @return parsed request
     * @throws ResourceValidationException if the syntax is wrong or the type is unknown
     */
    public AcceleratorRequest parse(String value) {
        if (value == null) {
            throw new ResourceValidationException("Accelerator must not be empty");
        }
        Matcher matcher = ACCELERATOR_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new ResourceValidationException(
                "Invalid accelerator '" + value + "', expected count:TYPE (e.g. 1:A100_SXM)");
        }

        int count;
        try {
            count = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new ResourceValidationException("Invalid accelerator count in '" + value + "'", e);
        }
        if (count < 1) {
            throw new ResourceValidationException("Accelerator count must be positive in '" + value + "'");
        }
        if (count > MAX_PER_NODE) {
            throw new ResourceValidationException(
                "Accelerator count in '" + value + "' exceeds " + MAX_PER_NODE + " per node");
        }

        String type = matcher.group(2);
        if (!supported.containsKey(type)) {
            throw new ResourceValidationException("Unknown accelerator type: " + type);
        }

        return AcceleratorRequest.builder()
            .count(count)
            .type(type)
            .build();
    }

    /**
     * Parse every option of a spec, preserving preference order.
     * No options means a CPU-only placement.
     */
    public List<AcceleratorRequest> parseAll(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of(AcceleratorRequest.none());
        }
        List<AcceleratorRequest> requests = new ArrayList<>(values.size());
        for (String value : values) {
            requests.add(parse(value));
        }
        return requests;
    }

    public boolean isSupported(String type) {
        return supported.containsKey(type);
    }

    public Integer memoryGb(String type) {
        return supported.get(type);
    }

    private static Map<String, Integer> toMap(List<OrbitProperties.AcceleratorConfig> accelerators) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (OrbitProperties.AcceleratorConfig accelerator : accelerators) {
            map.put(accelerator.getName(), accelerator.getMemory());
        }
        return map;
    }

    private static Map<String, Integer> defaults() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("A100_PCIe", 80);
        map.put("A100_SXM", 80);
        map.put("A30", 24);
        map.put("A40", 48);
        map.put("H100_NVL", 94);
        map.put("H100_PCIe", 80);
        map.put("H100_SXM", 80);
        map.put("H200_SXM", 143);
        map.put("L4", 24);
        map.put("L40", 48);
        map.put("L40S", 48);
        map.put("MI300X", 192);
        map.put("RTX_4090", 24);
        map.put("RTX_A4000", 16);
        map.put("RTX_A5000", 24);
        map.put("RTX_A6000", 48);
        map.put("RTX_6000_Ada", 48);
        map.put("T4", 16);
        map.put("V100", 16);
        map.put("V100_SXM2_32GB", 32);
        return Collections.unmodifiableMap(map);
    }
}
