package com.fetchman.controller;

import com.fetchman.dto.request.PlaceholderCheckRequest;
import com.fetchman.dto.request.UpdateVariablesRequest;
import com.fetchman.dto.response.PlaceholderReport;
import com.fetchman.dto.response.VariablesResponse;
import com.fetchman.service.api.RequestExecutionService;
import com.fetchman.service.api.VariableService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Management endpoints for the encrypted variables of one workspace.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/env")
@RequiredArgsConstructor
public class WorkspaceVariableController {

    private final VariableService variableService;
    private final RequestExecutionService executionService;

    @GetMapping
    public Mono<VariablesResponse> fetch(@PathVariable String workspaceId) {
        return variableService.fetch(workspaceId).map(VariablesResponse::new);
    }

    @PutMapping
    public Mono<VariablesResponse> update(@PathVariable String workspaceId, @RequestBody UpdateVariablesRequest request) {
        return variableService.update(workspaceId, request.variables()).map(VariablesResponse::new);
    }

    @PostMapping("/placeholders")
    public Mono<PlaceholderReport> placeholders(@PathVariable String workspaceId, @RequestBody PlaceholderCheckRequest request) {
        return executionService.inspectPlaceholders(request.toDraft(workspaceId));
    }
}
