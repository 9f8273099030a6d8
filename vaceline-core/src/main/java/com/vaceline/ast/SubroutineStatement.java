package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record SubroutineStatement(
    SourceLocation loc,
    Comments comments,
    Identifier id,
    List<Statement> body
) implements Statement {

    public SubroutineStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
        body = Nodes.mutable(body);
    }

    public SubroutineStatement(Identifier id, List<Statement> body) {
        this(null, null, id, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBROUTINE_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id), Child.list("body", body));
    }
}
