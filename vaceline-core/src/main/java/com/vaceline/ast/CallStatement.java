package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record CallStatement(SourceLocation loc, Comments comments, Identifier subroutine) implements Statement {

    public CallStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(subroutine, "subroutine");
    }

    public CallStatement(Identifier subroutine) {
        this(null, null, subroutine);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("subroutine", subroutine));
    }
}
