package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record LogStatement(SourceLocation loc, Comments comments, Expression content) implements Statement {

    public LogStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(content, "content");
    }

    public LogStatement(Expression content) {
        this(null, null, content);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOG_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("content", content));
    }
}
