package com.fetchman.service.impl;

import com.fetchman.exception.ExecutionFailedException;
import com.fetchman.model.EncodedBody;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.ExecutionResponse;
import com.fetchman.service.api.ExecutionGateway;
import com.fetchman.service.api.ResponseEncoder;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.netty.channel.ConnectTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Sends one request through the shared {@link WebClient} and turns whatever comes back (any status
 * code, any content type) into an {@link ExecutionResponse}.
 * <p>
 * HTTP error statuses are ordinary responses here. Only the failure to obtain a response at all
 * becomes an {@link ExecutionFailedException}, and it is never retried.
 */
@Service
@Slf4j
public class ExecutionGatewayImpl implements ExecutionGateway {

    /** Reported when the server sends no {@code Content-Type}. */
    public static final String DEFAULT_CONTENT_TYPE = MediaType.APPLICATION_OCTET_STREAM_VALUE;

    private static final Set<HttpMethod> PAYLOAD_METHODS = Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH);
    private static final MediaType DEFAULT_REQUEST_CONTENT_TYPE = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);
    private static final byte[] NO_CONTENT = new byte[0];

    private final WebClient webClient;
    private final ResponseEncoder responseEncoder;
    private final TimeLimiter timeLimiter;

    public ExecutionGatewayImpl(WebClient webClient, ResponseEncoder responseEncoder, TimeLimiter timeLimiter) {
        this.webClient = webClient;
        this.responseEncoder = responseEncoder;
        this.timeLimiter = timeLimiter;
    }

    @Override
    public Mono<ExecutionResponse> execute(ExecutionRequest request) {
        return Mono.defer(() -> send(request))
                .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                .onErrorMap(e -> !(e instanceof ExecutionFailedException), this::toExecutionFailure)
                .doOnError(e -> log.warn("{} request failed: {}", request.method(), e.getMessage()));
    }

    private Mono<ExecutionResponse> send(ExecutionRequest request) {
        URI uri = toUri(request.url());
        HttpMethod method = HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT));

        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(uri)
                .headers(headers -> request.headers().forEach((name, value) -> {
                    if (name != null && !name.isBlank() && value != null) {
                        headers.set(name, value);
                    }
                }));

        WebClient.RequestHeadersSpec<?> ready = spec;
        if (PAYLOAD_METHODS.contains(method) && request.hasBody()) {
            if (!containsHeader(request.headers(), HttpHeaders.CONTENT_TYPE)) {
                spec.contentType(DEFAULT_REQUEST_CONTENT_TYPE);
            }
            ready = spec.bodyValue(request.body().getBytes(StandardCharsets.UTF_8));
        } else if (request.hasBody()) {
            log.debug("Dropping body of {} request, the method does not carry a payload", method);
        }

        long startNanos = System.nanoTime();
        return ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(NO_CONTENT)
                .map(raw -> toExecutionResponse(response, raw, (System.nanoTime() - startNanos) / 1_000_000)))
                .doOnNext(result -> log.info("{} {} -> {} in {} ms ({} bytes)",
                        method, uri.getHost(), result.status(), result.elapsedMs(), result.sizeBytes()));
    }

    private ExecutionResponse toExecutionResponse(ClientResponse response, byte[] raw, long elapsedMs) {
        HttpHeaders headers = response.headers().asHttpHeaders();
        String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        EncodedBody encoded = responseEncoder.encode(raw, contentType, headers.getFirst(HttpHeaders.CONTENT_DISPOSITION));

        int status = response.statusCode().value();
        HttpStatus known = HttpStatus.resolve(status);
        return ExecutionResponse.of(
                status,
                known != null ? known.getReasonPhrase() : "",
                flatten(headers),
                encoded,
                contentType != null ? contentType : DEFAULT_CONTENT_TYPE,
                elapsedMs,
                raw.length);
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            flat.merge(entry.getKey().toLowerCase(Locale.ROOT), String.join(", ", entry.getValue()),
                    (first, second) -> first + ", " + second);
        }
        return flat;
    }

    private static boolean containsHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    /**
     * Parses the URL as given; URLs with characters that are illegal in a URI (for example an
     * unresolved placeholder in the path) are encoded component by component instead.
     */
    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new ExecutionFailedException("Request URL is empty", null);
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            try {
                uri = UriComponentsBuilder.fromUriString(url.trim()).build().encode().toUri();
            } catch (IllegalArgumentException | IllegalStateException nested) {
                throw new ExecutionFailedException("Invalid URL: " + e.getReason(), nested);
            }
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
            throw new ExecutionFailedException("Invalid URL: an absolute http or https URL is required", null);
        }
        return uri;
    }

    private ExecutionFailedException toExecutionFailure(Throwable error) {
        if (causedBy(error, TimeoutException.class)) {
            return new ExecutionFailedException("Request timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + " ms", error, true);
        }
        if (causedBy(error, DataBufferLimitException.class)) {
            return new ExecutionFailedException("Response body exceeds the configured in-memory limit", error);
        }
        if (error instanceof WebClientRequestException requestException) {
            Throwable cause = requestException.getMostSpecificCause();
            boolean timedOut = cause instanceof ConnectTimeoutException;
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new ExecutionFailedException(detail, error, timedOut);
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ExecutionFailedException(detail, error);
    }

    // WebClient may wrap decoding failures, so the whole cause chain is inspected.
    private static boolean causedBy(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
