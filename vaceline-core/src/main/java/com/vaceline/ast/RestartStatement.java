package com.vaceline.ast;

import java.util.List;

public record RestartStatement(SourceLocation loc, Comments comments) implements Statement {

    public RestartStatement {
        comments = Comments.orEmpty(comments);
    }

    public RestartStatement() {
        this(null, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RESTART_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
