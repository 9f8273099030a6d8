package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * Header field name in a member chain, e.g. {@code X-Forwarded-For} in {@code req.http.X-Forwarded-For}.
 */
public record Header(SourceLocation loc, String name) implements Expression {

    public Header {
        Objects.requireNonNull(name, "name");
    }

    public Header(String name) {
        this(null, name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEADER;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
