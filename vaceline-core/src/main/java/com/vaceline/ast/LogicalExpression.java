package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record LogicalExpression(
    SourceLocation loc,
    Expression left,
    String operator,
    Expression right
) implements Expression {

    public LogicalExpression {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    public LogicalExpression(Expression left, String operator, Expression right) {
        this(null, left, operator, right);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOGICAL_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("left", left), Child.node("right", right));
    }
}
