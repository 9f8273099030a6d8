package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code base:name}, e.g. {@code req.http.Cookie:session}.
 */
public record ValuePair(SourceLocation loc, Expression base, Identifier name) implements Expression {

    public ValuePair {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(name, "name");
    }

    public ValuePair(Expression base, Identifier name) {
        this(null, base, name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VALUE_PAIR;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("base", base), Child.node("name", name));
    }
}
