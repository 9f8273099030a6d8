package com.vaceline.ast;

public record NumericLiteral(SourceLocation loc, String value) implements Literal {

    public NumericLiteral(String value) {
        this(null, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NUMERIC_LITERAL;
    }
}
