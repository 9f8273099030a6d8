package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code "key": "value"} entry of a table; both sides are raw string literals, quotes included.
 */
public record TableDefinition(SourceLocation loc, String key, String value) implements Node {

    public TableDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public TableDefinition(String key, String value) {
        this(null, key, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE_DEFINITION;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
