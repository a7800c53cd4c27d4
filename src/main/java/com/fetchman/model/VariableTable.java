package com.fetchman.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decrypted identifier-to-plaintext lookup used for one execution only.
 * <p>
 * Built fresh for every request and never persisted, cached, or serialized; {@link #toString()}
 * prints only the variable names.
 */
public final class VariableTable {

    private static final VariableTable EMPTY = new VariableTable(Collections.emptyMap());

    private final Map<String, String> values;

    private VariableTable(Map<String, String> values) {
        this.values = values;
    }

    public static VariableTable empty() {
        return EMPTY;
    }

    public static VariableTable of(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new VariableTable(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "VariableTable" + values.keySet();
    }
}
