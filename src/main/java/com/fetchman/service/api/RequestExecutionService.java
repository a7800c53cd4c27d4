package com.fetchman.service.api;

import com.fetchman.dto.response.PlaceholderReport;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.ExecutionResponse;
import reactor.core.publisher.Mono;

/**
 * Entry point behind the execute operation: validation, variable substitution and the outbound call.
 */
public interface RequestExecutionService {

    Mono<ExecutionResponse> execute(ExecutionRequest request);

    /**
     * Reports which placeholders a draft request references and which of them the workspace
     * cannot resolve. Variable values are never part of the report.
     */
    Mono<PlaceholderReport> inspectPlaceholders(ExecutionRequest draft);
}
