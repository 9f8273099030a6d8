package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code declare local var.name TYPE;}
 */
public record DeclareStatement(
    SourceLocation loc,
    Comments comments,
    Expression id,
    String valueType
) implements Statement {

    public DeclareStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(valueType, "valueType");
    }

    public DeclareStatement(Expression id, String valueType) {
        this(null, null, id, valueType);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECLARE_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id));
    }
}
