package com.fetchman.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fetchman.exception.ConfigurationException;
import com.fetchman.exception.ExecutionFailedException;
import com.fetchman.exception.InvalidRequestException;
import com.fetchman.model.EncodedBody;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.ExecutionResponse;
import com.fetchman.service.api.RequestExecutionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ExecuteController.class)
class ExecuteControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private RequestExecutionService executionService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void execute_shouldReturnStructuredResponse() throws Exception {
        // --- Arrange ---
        EncodedBody body = EncodedBody.json(objectMapper.readTree("{\"a\":1}"), "{\"a\":1}");
        ExecutionResponse response = ExecutionResponse.of(200, "OK", Map.of("content-type", "application/json"),
                body, "application/json", 12, 7);
        when(executionService.execute(any())).thenReturn(Mono.just(response));

        // --- Act & Assert ---
        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "get", "url", "https://example.com/{{id}}", "workspaceId", "ws-1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo(200)
                .jsonPath("$.statusText").isEqualTo("OK")
                .jsonPath("$.bodyType").isEqualTo("json")
                .jsonPath("$.body.a").isEqualTo(1)
                .jsonPath("$.bodyText").isEqualTo("{\"a\":1}")
                .jsonPath("$.encoding").isEqualTo("utf8")
                .jsonPath("$.contentType").isEqualTo("application/json")
                .jsonPath("$.elapsedMs").isEqualTo(12)
                .jsonPath("$.sizeBytes").isEqualTo(7);

        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executionService).execute(captor.capture());
        assertThat(captor.getValue().url()).isEqualTo("https://example.com/{{id}}");
        assertThat(captor.getValue().workspaceId()).isEqualTo("ws-1");
    }

    @Test
    void execute_shouldRejectMissingUrl() {
        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid request")
                .jsonPath("$.message").isEqualTo("url is required");

        verifyNoInteractions(executionService);
    }

    @Test
    void execute_shouldRejectUnreadableBody() {
        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid request");
    }

    @Test
    void execute_shouldMapUnsupportedMethodToBadRequest() {
        when(executionService.execute(any()))
                .thenReturn(Mono.error(new InvalidRequestException("Unsupported HTTP method: TRACE")));

        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "TRACE", "url", "https://example.com"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unsupported HTTP method: TRACE");
    }

    @Test
    void execute_shouldMapTransportFailureToBadGateway() {
        when(executionService.execute(any()))
                .thenReturn(Mono.error(new ExecutionFailedException("Connection refused", null)));

        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET", "url", "http://localhost:1"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to execute request")
                .jsonPath("$.message").isEqualTo("Connection refused");
    }

    @Test
    void execute_shouldMapTimeoutToGatewayTimeout() {
        when(executionService.execute(any()))
                .thenReturn(Mono.error(new ExecutionFailedException("Request timed out after 30000 ms", null, true)));

        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET", "url", "https://slow.example.com"))
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to execute request");
    }

    @Test
    void execute_shouldReportMissingEncryptionSecret() {
        when(executionService.execute(any()))
                .thenReturn(Mono.error(new ConfigurationException("Missing encryption secret")));

        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET", "url", "https://example.com", "workspaceId", "ws-1"))
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Encryption is not configured");
    }

    @Test
    void execute_shouldReportUnsupportedMediaTypeAsErrorObject() {
        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("GET https://example.com")
                .exchange()
                .expectStatus().isEqualTo(415)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unsupported Media Type")
                .jsonPath("$.message").isNotEmpty();

        verifyNoInteractions(executionService);
    }

    @Test
    void execute_shouldReportWrongMethodAsErrorObject() {
        webTestClient.get().uri("/api/execute")
                .exchange()
                .expectStatus().isEqualTo(405)
                .expectHeader().valueMatches("Allow", ".*POST.*")
                .expectBody()
                .jsonPath("$.error").isEqualTo("Method Not Allowed")
                .jsonPath("$.message").isNotEmpty();
    }

    @Test
    void execute_shouldHideUnexpectedFailuresBehindErrorObject() {
        when(executionService.execute(any()))
                .thenReturn(Mono.error(new IllegalStateException("AES-GCM encryption failed")));

        webTestClient.post().uri("/api/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET", "url", "https://example.com"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Internal error")
                .jsonPath("$.message").isEqualTo("Unexpected error while processing the request");
    }
}
