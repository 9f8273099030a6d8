package com.vaceline.ast;

public record MultilineLiteral(SourceLocation loc, String value) implements Literal {

    public MultilineLiteral(String value) {
        this(null, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MULTILINE_LITERAL;
    }
}
