package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code error <status> [message];}. {@code message} may be null.
 */
public record ErrorStatement(
    SourceLocation loc,
    Comments comments,
    Literal status,
    Expression message
) implements Statement {

    public ErrorStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(status, "status");
    }

    public ErrorStatement(Literal status, Expression message) {
        this(null, null, status, message);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ERROR_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("status", status), Child.node("message", message));
    }
}
