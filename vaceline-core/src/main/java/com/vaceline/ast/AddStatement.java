package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record AddStatement(
    SourceLocation loc,
    Comments comments,
    Expression left,
    String operator,
    Expression right
) implements Statement {

    public AddStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    public AddStatement(Expression left, String operator, Expression right) {
        this(null, null, left, operator, right);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ADD_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("left", left), Child.node("right", right));
    }
}
