package com.fetchman.service.api;

import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.ExecutionResponse;
import reactor.core.publisher.Mono;

public interface ExecutionGateway {

    /**
     * Performs exactly one outbound HTTP call for an already substituted request.
     *
     * @param request The request to send.
     * @return The timed and classified response; errors with
     *         {@link com.fetchman.exception.ExecutionFailedException} when no response could be obtained.
     */
    Mono<ExecutionResponse> execute(ExecutionRequest request);
}
