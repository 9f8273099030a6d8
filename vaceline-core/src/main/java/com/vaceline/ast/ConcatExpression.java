package com.vaceline.ast;

import java.util.List;

/**
 * Implicit string concatenation of two or more adjacent expressions.
 */
public record ConcatExpression(SourceLocation loc, List<Expression> body) implements Expression {

    public ConcatExpression {
        body = Nodes.mutable(body);
    }

    public ConcatExpression(List<Expression> body) {
        this(null, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONCAT_EXPRESSION;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.list("body", body));
    }
}
