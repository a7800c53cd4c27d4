package com.fetchman.service.api;

import com.fetchman.model.VariableRecord;

import java.util.List;

/**
 * Persistence contract for the encrypted variable records of each workspace.
 * Any key-value or document store can satisfy it; values are opaque envelopes at this level.
 */
public interface SecretStore {

    /**
     * Loads the records of a workspace.
     *
     * @param workspaceId The workspace identifier.
     * @return The stored records, or an empty list if the workspace has none. Never {@code null}.
     */
    List<VariableRecord> load(String workspaceId);

    /**
     * Replaces the complete record set of a workspace, creating it if absent.
     *
     * @param workspaceId The workspace identifier.
     * @param records     The new record set.
     * @return The records as persisted.
     */
    List<VariableRecord> save(String workspaceId, List<VariableRecord> records);

    /**
     * @return {@code true} if the backing storage can currently be read and written.
     */
    boolean isAvailable();
}
