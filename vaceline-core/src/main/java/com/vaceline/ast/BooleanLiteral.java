package com.vaceline.ast;

public record BooleanLiteral(SourceLocation loc, String value) implements Literal {

    public BooleanLiteral(String value) {
        this(null, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOLEAN_LITERAL;
    }
}
