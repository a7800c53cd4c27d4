package com.fetchman.dto.request;

import com.fetchman.model.ExecutionRequest;

import java.util.Map;

/**
 * Draft request parts to scan for placeholders.
 */
public record PlaceholderCheckRequest(String url, Map<String, String> headers, String body) {

    public ExecutionRequest toDraft(String workspaceId) {
        return new ExecutionRequest(null, url, headers, body, workspaceId);
    }
}
