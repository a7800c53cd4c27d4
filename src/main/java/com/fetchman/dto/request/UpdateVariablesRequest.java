package com.fetchman.dto.request;

import java.util.List;

/**
 * Full replacement list for {@code PUT /api/workspaces/{id}/env}.
 */
public record UpdateVariablesRequest(List<VariableInput> variables) {
}
