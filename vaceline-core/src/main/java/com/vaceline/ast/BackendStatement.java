package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record BackendStatement(
    SourceLocation loc,
    Comments comments,
    Identifier id,
    List<BackendDefinition> body
) implements Statement {

    public BackendStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
        body = Nodes.mutable(body);
    }

    public BackendStatement(Identifier id, List<BackendDefinition> body) {
        this(null, null, id, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BACKEND_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id), Child.list("body", body));
    }
}
