package com.fetchman.controller;

import com.fetchman.dto.response.HealthResponse;
import com.fetchman.security.AesGcmStringEncryptor;
import com.fetchman.service.api.SecretStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final SecretStore secretStore;
    private final AesGcmStringEncryptor encryptor;

    /**
     * Healthy as long as the variable store is usable. A missing encryption secret is reported but
     * does not make the service unhealthy, since requests without a workspace still execute.
     */
    @GetMapping
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(secretStore::isAvailable)
                .subscribeOn(Schedulers.boundedElastic())
                .map(available -> {
                    HealthResponse body = new HealthResponse(
                            available ? "healthy" : "unhealthy",
                            available ? "available" : "unavailable",
                            encryptor.isConfigured() ? "configured" : "not_configured",
                            Instant.now().toString());
                    return ResponseEntity.status(available ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
                });
    }
}
