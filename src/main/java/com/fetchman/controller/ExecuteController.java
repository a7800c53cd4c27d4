package com.fetchman.controller;

import com.fetchman.dto.request.ExecuteRequest;
import com.fetchman.model.ExecutionResponse;
import com.fetchman.service.api.RequestExecutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Executes a draft request on behalf of the caller.
 */
@RestController
@RequestMapping("/api/execute")
@RequiredArgsConstructor
public class ExecuteController {

    private final RequestExecutionService executionService;

    @PostMapping
    public Mono<ExecutionResponse> execute(@Valid @RequestBody ExecuteRequest request) {
        return executionService.execute(request.toExecutionRequest());
    }
}
