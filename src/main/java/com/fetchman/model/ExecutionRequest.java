package com.fetchman.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One draft request to execute. Header order is preserved; a {@code null} header map becomes empty.
 *
 * @param method      HTTP method name, upper case.
 * @param url         Target URL, possibly containing {@code {{name}}} placeholders.
 * @param headers     Request headers.
 * @param body        Raw request body, may be {@code null}.
 * @param workspaceId Workspace whose variables apply, may be {@code null}.
 */
public record ExecutionRequest(String method, String url, Map<String, String> headers, String body, String workspaceId) {

    public ExecutionRequest {
        headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Returns a copy carrying rewritten URL, headers and body; method and workspace are kept.
     */
    public ExecutionRequest rewrite(String newUrl, Map<String, String> newHeaders, String newBody) {
        return new ExecutionRequest(method, newUrl, newHeaders, newBody, workspaceId);
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
