package com.fetchman.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.VariableTable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Single-pass substitution of {@code {{identifier}}} placeholders.
 * <p>
 * An identifier starts with a letter or underscore followed by letters, digits or underscores, and
 * may be padded with horizontal whitespace inside the braces. Placeholders without a value in the
 * table are kept verbatim. Substituted values are never re-scanned.
 */
public interface TemplateEngine {

    String substituteString(String text, VariableTable table);

    /**
     * Substitutes keys and values of objects recursively and string elements of arrays.
     * Every other node is returned unchanged.
     */
    JsonNode substituteStructure(JsonNode node, VariableTable table);

    /**
     * Substitutes both names and values of a header map, keeping its order.
     */
    Map<String, String> substituteHeaders(Map<String, String> headers, VariableTable table);

    /**
     * Rewrites URL, headers and body of a request with the variables of a workspace.
     * <p>
     * Returns the very same request when the workspace has no usable variables. If rewriting fails
     * the original request is returned and the failure is logged.
     */
    Mono<ExecutionRequest> substituteRequest(ExecutionRequest request, String workspaceId);

    boolean hasPlaceholders(String text);

    /**
     * @return The distinct identifiers referenced by {@code text}, in order of first appearance.
     */
    List<String> extractPlaceholderNames(String text);
}
