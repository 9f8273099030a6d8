package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record ReturnStatement(SourceLocation loc, Comments comments, String action) implements Statement {

    public ReturnStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(action, "action");
    }

    public ReturnStatement(String action) {
        this(null, null, action);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
