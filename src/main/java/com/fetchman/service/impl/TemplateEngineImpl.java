package com.fetchman.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fetchman.exception.ConfigurationException;
import com.fetchman.exception.SubstitutionException;
import com.fetchman.model.ExecutionRequest;
import com.fetchman.model.VariableTable;
import com.fetchman.service.api.TemplateEngine;
import com.fetchman.service.api.VariableResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The regex-based implementation of the {@link TemplateEngine}.
 * <p>
 * Values are inserted literally in one left-to-right pass. When a whole request is rewritten, only a
 * missing encryption secret fails the call; any other problem sends the request as it was drafted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateEngineImpl implements TemplateEngine {

    /**
     * {@code {{name}}} with optional horizontal whitespace inside the braces. Group 1 is the identifier.
     */
    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\h*([A-Za-z_][A-Za-z0-9_]*)\\h*}}");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final VariableResolver variableResolver;

    @Override
    public String substituteString(String text, VariableTable table) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            Optional<String> value = table.lookup(name);
            if (value.isPresent()) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(value.get()));
            } else {
                log.warn("Variable '{}' not found in workspace variables, leaving placeholder unchanged", name);
                matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group()));
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public JsonNode substituteStructure(JsonNode node, VariableTable table) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return NODES.textNode(substituteString(node.textValue(), table));
        }
        if (node.isObject()) {
            return substituteObject((ObjectNode) node, table);
        }
        if (node.isArray()) {
            return substituteArray((ArrayNode) node, table);
        }
        return node;
    }

    private ObjectNode substituteObject(ObjectNode source, VariableTable table) {
        ObjectNode target = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            target.set(substituteString(field.getKey(), table), substituteStructure(field.getValue(), table));
        }
        return target;
    }

    // Only string elements are rewritten; nested containers inside an array are left as they are.
    private ArrayNode substituteArray(ArrayNode source, VariableTable table) {
        ArrayNode target = NODES.arrayNode(source.size());
        for (JsonNode element : source) {
            target.add(element.isTextual() ? NODES.textNode(substituteString(element.textValue(), table)) : element);
        }
        return target;
    }

    @Override
    public Map<String, String> substituteHeaders(Map<String, String> headers, VariableTable table) {
        if (headers == null) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, value) -> result.put(substituteString(name, table), substituteString(value, table)));
        return result;
    }

    @Override
    public Mono<ExecutionRequest> substituteRequest(ExecutionRequest request, String workspaceId) {
        return variableResolver.resolve(workspaceId)
                .map(table -> table.isEmpty() ? request : rewrite(request, table))
                .onErrorResume(e -> !(e instanceof ConfigurationException), e -> {
                    log.error("Could not load variables for workspace '{}', sending request unsubstituted", workspaceId, e);
                    return Mono.just(request);
                });
    }

    private ExecutionRequest rewrite(ExecutionRequest request, VariableTable table) {
        try {
            return request.rewrite(
                    substituteString(request.url(), table),
                    substituteHeaders(request.headers(), table),
                    substituteString(request.body(), table));
        } catch (RuntimeException e) {
            SubstitutionException failure = new SubstitutionException("Variable substitution failed", e);
            log.error("Sending request unsubstituted: {}", failure.getMessage(), failure);
            return request;
        }
    }

    @Override
    public boolean hasPlaceholders(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    @Override
    public List<String> extractPlaceholderNames(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new ArrayList<>(names);
    }
}
