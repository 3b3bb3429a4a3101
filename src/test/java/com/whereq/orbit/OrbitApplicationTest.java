package com.whereq.orbit;

import com.whereq.orbit.dto.ResourceRequest;
import com.whereq.orbit.dto.ResourceResponse;
import com.whereq.orbit.model.Resource;
import com.whereq.orbit.model.ResourceKind;
import com.whereq.orbit.model.ResourcePhase;
import com.whereq.orbit.service.ResourceService;
import com.whereq.orbit.support.TestResources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "orbit.store.type=memory",
    "orbit.reconcile.recheck-interval=50ms"
})
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@DisplayName("Orbit API Tests")
class OrbitApplicationTest {

    private static final String OWNER = "X-Orbit-Owner";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ResourceService resourceService;

    @Test
    @DisplayName("Health reports the configured platforms")
    void testHealth() {
        webTestClient.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.platforms[0]").isEqualTo("ec2");
    }

    @Test
    @DisplayName("A submitted container is accepted and placed on a simulated platform")
    void testSubmitAndRun() {
        ResourceResponse accepted = webTestClient.post().uri("/api/v1/resources")
            .header(OWNER, "alice")
            .bodyValue(request("api-smoke"))
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().exists("Location")
            .expectBody(ResourceResponse.class)
            .returnResult()
            .getResponseBody();

        assertNotNull(accepted);
        assertEquals("alice", accepted.getOwner());

        Resource running = resourceService.get(accepted.getId())
            .filter(resource -> resource.phase() == ResourcePhase.RUNNING)
            .repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(50)))
            .block(Duration.ofSeconds(10));
        assertEquals("ec2", running.getStatus().getInstances().get(0).getPlatform());

        webTestClient.get().uri("/api/v1/resources/{id}/events", accepted.getId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].phase").isEqualTo("PENDING");
    }

    @Test
    @DisplayName("A second submission under the same name conflicts")
    void testDuplicateSubmission() {
        webTestClient.post().uri("/api/v1/resources")
            .header(OWNER, "bob")
            .bodyValue(request("api-duplicate"))
            .exchange()
            .expectStatus().isAccepted();

        webTestClient.post().uri("/api/v1/resources")
            .header(OWNER, "bob")
            .bodyValue(request("api-duplicate"))
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.errorMessage").exists();
    }

    @Test
    @DisplayName("Malformed requests and unknown ids are rejected")
    void testRejections() {
        ResourceRequest reservedQueue = request("api-reserved");
        reservedQueue.setSpec(TestResources.containerSpec().queue("system").build());

        webTestClient.post().uri("/api/v1/resources")
            .bodyValue(reservedQueue)
            .exchange()
            .expectStatus().isBadRequest();

        webTestClient.get().uri("/api/v1/resources/{id}", "res-missing")
            .exchange()
            .expectStatus().isNotFound();

        webTestClient.get().uri("/api/v1/queues/{name}", "no-such-queue")
            .exchange()
            .expectStatus().isNotFound();
    }

    private static ResourceRequest request(String name) {
        return ResourceRequest.builder()
            .name(name)
            .namespace("default")
            .kind(ResourceKind.CONTAINER)
            .spec(TestResources.containerSpec().build())
            .build();
    }
}
