package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record FunCallExpression(SourceLocation loc, Expression callee, List<Expression> arguments) implements Expression {

    public FunCallExpression {
        Objects.requireNonNull(callee, "callee");
        arguments = Nodes.mutable(arguments);
    }

    public FunCallExpression(Expression callee, List<Expression> arguments) {
        this(null, callee, arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUN_CALL_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("callee", callee), Child.list("arguments", arguments));
    }
}
