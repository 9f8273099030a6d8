package com.vaceline.ast;

public record DurationLiteral(SourceLocation loc, String value) implements Literal {

    public DurationLiteral(String value) {
        this(null, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DURATION_LITERAL;
    }
}
