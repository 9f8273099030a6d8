package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code .key = ...} entry of a backend. Exactly one of {@code value} (a leaf assignment) and
 * {@code body} (a nested block such as {@code .probe = { ... }}) is set.
 */
public record BackendDefinition(
    SourceLocation loc,
    String key,
    Expression value,
    List<BackendDefinition> body
) implements Node {

    public BackendDefinition {
        Objects.requireNonNull(key, "key");
        if ((value == null) == (body == null)) {
            throw new IllegalArgumentException("BackendDefinition '" + key + "' needs either a value or a nested body");
        }
        if (body != null) {
            body = Nodes.mutable(body);
        }
    }

    public BackendDefinition(String key, Expression value) {
        this(null, key, value, null);
    }

    public BackendDefinition(String key, List<BackendDefinition> body) {
        this(null, key, null, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BACKEND_DEFINITION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("value", value), Child.list("body", body));
    }
}
