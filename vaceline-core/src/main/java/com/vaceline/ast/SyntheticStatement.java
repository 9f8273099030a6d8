package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code synthetic <response>;} sets the body of a synthetic response.
 */
public record SyntheticStatement(SourceLocation loc, Comments comments, Expression response) implements Statement {

    public SyntheticStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(response, "response");
    }

    public SyntheticStatement(Expression response) {
        this(null, null, response);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SYNTHETIC_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("response", response));
    }
}
