package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record UnaryExpression(SourceLocation loc, String operator, Expression argument) implements Expression {

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(argument, "argument");
    }

    public UnaryExpression(String operator, Expression argument) {
        this(null, operator, argument);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("argument", argument));
    }
}
