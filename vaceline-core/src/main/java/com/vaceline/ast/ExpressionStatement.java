package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record ExpressionStatement(SourceLocation loc, Comments comments, Expression body) implements Statement {

    public ExpressionStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(body, "body");
    }

    public ExpressionStatement(Expression body) {
        this(null, null, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("body", body));
    }
}
