package com.fetchman.dto.request;

import com.fetchman.model.ExecutionRequest;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of {@code POST /api/execute}.
 *
 * @param method      HTTP method, case-insensitive.
 * @param url         Target URL, may contain placeholders.
 * @param headers     Optional request headers.
 * @param body        Optional raw body; only sent for POST, PUT and PATCH.
 * @param workspaceId Optional workspace whose variables are substituted.
 */
public record ExecuteRequest(
        @NotBlank(message = "method is required") String method,
        @NotBlank(message = "url is required") String url,
        Map<String, String> headers,
        String body,
        String workspaceId) {

    public ExecutionRequest toExecutionRequest() {
        return new ExecutionRequest(method, url, headers, body, workspaceId);
    }
}
