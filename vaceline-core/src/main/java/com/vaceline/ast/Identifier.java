package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record Identifier(SourceLocation loc, String name) implements Expression {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    public Identifier(String name) {
        this(null, name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
