package com.vaceline.ast;

public record StringLiteral(SourceLocation loc, String value) implements Literal {

    public StringLiteral(String value) {
        this(null, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING_LITERAL;
    }
}
