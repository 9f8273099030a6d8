package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record TableStatement(
    SourceLocation loc,
    Comments comments,
    Identifier id,
    List<TableDefinition> body
) implements Statement {

    public TableStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
        body = Nodes.mutable(body);
    }

    public TableStatement(Identifier id, List<TableDefinition> body) {
        this(null, null, id, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id), Child.list("body", body));
    }
}
