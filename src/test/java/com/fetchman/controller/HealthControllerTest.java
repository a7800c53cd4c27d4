package com.fetchman.controller;

import com.fetchman.security.AesGcmStringEncryptor;
import com.fetchman.service.api.SecretStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = HealthController.class)
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private SecretStore secretStore;

    @MockitoBean
    private AesGcmStringEncryptor encryptor;

    @Test
    void health_shouldBeHealthyWhenStoreIsAvailable() {
        when(secretStore.isAvailable()).thenReturn(true);
        when(encryptor.isConfigured()).thenReturn(true);

        webTestClient.get().uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.store").isEqualTo("available")
                .jsonPath("$.encryption").isEqualTo("configured")
                .jsonPath("$.timestamp").isNotEmpty();
    }

    @Test
    void health_shouldStayHealthyWithoutEncryptionSecret() {
        when(secretStore.isAvailable()).thenReturn(true);
        when(encryptor.isConfigured()).thenReturn(false);

        webTestClient.get().uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.encryption").isEqualTo("not_configured");
    }

    @Test
    void health_shouldBeUnavailableWhenStoreIsNotUsable() {
        when(secretStore.isAvailable()).thenReturn(false);

        webTestClient.get().uri("/api/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("unhealthy")
                .jsonPath("$.store").isEqualTo("unavailable");
    }
}
