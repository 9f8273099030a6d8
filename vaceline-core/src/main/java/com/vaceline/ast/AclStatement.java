package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record AclStatement(
    SourceLocation loc,
    Comments comments,
    Identifier id,
    List<Ip> body
) implements Statement {

    public AclStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(id, "id");
        body = Nodes.mutable(body);
    }

    public AclStatement(Identifier id, List<Ip> body) {
        this(null, null, id, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ACL_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("id", id), Child.list("body", body));
    }
}
