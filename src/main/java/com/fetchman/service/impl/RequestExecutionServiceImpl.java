package com.fetchman.service.impl;

import com.fetchman.dto.response.PlaceholderReport;
import com.fetchman.exception.InvalidRequestException;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.ExecutionResponse;
import com.fetchman.service.api.ExecutionGateway;
import com.fetchman.service.api.RequestExecutionService;
import com.fetchman.service.api.TemplateEngine;
import com.fetchman.service.api.VariableResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Orchestrates one execution: normalizes and validates the draft, substitutes workspace variables
 * and hands the result to the {@link ExecutionGateway}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestExecutionServiceImpl implements RequestExecutionService {

    static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    private final TemplateEngine templateEngine;
    private final VariableResolver variableResolver;
    private final ExecutionGateway executionGateway;

    /**
     * {@inheritDoc}
     * <p>
     * The method is normalized to upper case before anything else; unknown methods are rejected
     * without contacting the variable store or the target.
     */
    @Override
    public Mono<ExecutionResponse> execute(ExecutionRequest request) {
        return Mono.fromCallable(() -> normalize(request))
                .flatMap(normalized -> templateEngine.substituteRequest(normalized, normalized.workspaceId()))
                .flatMap(executionGateway::execute);
    }

    private ExecutionRequest normalize(ExecutionRequest request) {
        String method = request.method() == null ? "" : request.method().trim().toUpperCase(Locale.ROOT);
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new InvalidRequestException("Unsupported HTTP method: " + request.method());
        }
        if (request.url() == null || request.url().isBlank()) {
            throw new InvalidRequestException("Request URL is required");
        }
        return new ExecutionRequest(method, request.url(), request.headers(), request.body(), request.workspaceId());
    }

    @Override
    public Mono<PlaceholderReport> inspectPlaceholders(ExecutionRequest draft) {
        Set<String> referenced = new LinkedHashSet<>(templateEngine.extractPlaceholderNames(draft.url()));
        draft.headers().forEach((name, value) -> {
            referenced.addAll(templateEngine.extractPlaceholderNames(name));
            referenced.addAll(templateEngine.extractPlaceholderNames(value));
        });
        referenced.addAll(templateEngine.extractPlaceholderNames(draft.body()));

        List<String> placeholders = new ArrayList<>(referenced);
        if (placeholders.isEmpty()) {
            return Mono.just(new PlaceholderReport(placeholders, List.of()));
        }
        return variableResolver.resolve(draft.workspaceId())
                .map(table -> new PlaceholderReport(placeholders,
                        placeholders.stream().filter(name -> !table.contains(name)).toList()));
    }
}
