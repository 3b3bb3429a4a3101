package com.whereq.orbit.support;

import com.whereq.orbit.model.ClusterSpec;
import com.whereq.orbit.model.ProcessorSpec;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceDraft;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourceSpec;
import com.whereq.orbit.model.ResourceStatus;
import com.whereq.orbit.model.ScalePolicy;
import com.whereq.orbit.model.ServiceSpec;

import java.time.Instant;
import java.util.List;

/**
 * Resource fixtures shared by the tests
 */
public final class TestResources {

    public static final String IMAGE = "registry.example.com/trainer:1.4";

    private TestResources() {
    }

    public static ResourceSpec.ResourceSpecBuilder containerSpec() {
        return ResourceSpec.builder().image(IMAGE);
    }

    public static ResourceDraft container(String name) {
        return draft(name, ResourceKind.CONTAINER, containerSpec().build());
    }

    public static ResourceDraft queuedContainer(String name, String queue) {
        return draft(name, ResourceKind.CONTAINER, containerSpec().queue(queue).build());
    }

    public static ResourceDraft cluster(String name, int nodes, String... accelerators) {
        return draft(name, ResourceKind.CLUSTER, containerSpec()
            .accelerators(List.of(accelerators))
            .cluster(ClusterSpec.builder().numNodes(nodes).build())
            .build());
    }

    public static ResourceDraft service(String name, Integer min, Integer max, ScalePolicy scale) {
        return draft(name, ResourceKind.SERVICE, containerSpec()
            .service(ServiceSpec.builder().minContainers(min).maxContainers(max).scale(scale).port(8080).build())
            .build());
    }

    public static ResourceDraft processor(String name, Integer min, Integer max, ScalePolicy scale) {
        return draft(name, ResourceKind.PROCESSOR, containerSpec()
            .processor(ProcessorSpec.builder().stream("orders").minReplicas(min).maxReplicas(max).scale(scale).build())
            .build());
    }

    public static ResourceDraft draft(String name, ResourceKind kind, ResourceSpec spec) {
        return ResourceDraft.builder()
            .name(name)
            .namespace("default")
            .owner("alice")
            .kind(kind)
            .spec(spec)
            .build();
    }

    /**
     * A stored-looking resource, for components that never touch the store
     */
    public static Resource resource(String id, ResourceDraft draft, ResourceStatus status) {
        return Resource.builder()
            .id(id)
            .name(draft.getName())
            .namespace(draft.getNamespace())
            .owner(draft.getOwner())
            .kind(draft.getKind())
            .spec(draft.getSpec())
            .status(status)
            .generation(1)
            .resourceVersion(1)
            .createdAt(Instant.EPOCH)
            .build();
    }
}
