package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * A parenthesized expression.
 */
public record BooleanExpression(SourceLocation loc, Expression body) implements Expression {

    public BooleanExpression {
        Objects.requireNonNull(body, "body");
    }

    public BooleanExpression(Expression body) {
        this(null, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOLEAN_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("body", body));
    }
}
