package com.whereq.orbit.dto;

import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourceSpec;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create or update request for a resource.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRequest {

    /**
     * Resource name, unique per owner and namespace
     */
    @NotBlank
    @Pattern(regexp = "[a-z0-9][a-z0-9-]{0,62}", message = "lowercase letters, digits and '-' only, max 63 chars")
    private String name;

    /**
     * Namespace, defaults to "default"
     */
    @Builder.Default
    private String namespace = "default";

    /**
     * Options: CONTAINER, PROCESSOR, SERVICE, CLUSTER
     */
    @NotNull
    private ResourceKind kind;

    /**
     * Desired state; carries the payload matching {@code kind}
     */
    @NotNull
    private ResourceSpec spec;
}
