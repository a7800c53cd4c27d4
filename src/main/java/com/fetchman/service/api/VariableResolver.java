package com.fetchman.service.api;

import com.fetchman.model.VariableTable;
import reactor.core.publisher.Mono;

public interface VariableResolver {

    /**
     * Loads and decrypts the variables of a workspace into a table for a single execution.
     * Records that fail to decrypt are logged and left out; they never fail the resolution.
     *
     * @param workspaceId The workspace, may be {@code null} or blank.
     * @return The table, empty when there is no workspace or it has no variables.
     */
    Mono<VariableTable> resolve(String workspaceId);
}
