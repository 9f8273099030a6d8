package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record BinaryExpression(
    SourceLocation loc,
    Expression left,
    String operator,
    Expression right
) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    public BinaryExpression(Expression left, String operator, Expression right) {
        this(null, left, operator, right);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("left", left), Child.node("right", right));
    }
}
