package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record UnsetStatement(SourceLocation loc, Comments comments, Expression id) implements Statement {

    public UnsetStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
    }

    public UnsetStatement(Expression id) {
        this(null, null, id);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNSET_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id));
    }
}
