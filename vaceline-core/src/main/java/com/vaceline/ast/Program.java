package com.vaceline.ast;

import java.util.List;

/**
 * Root of a parsed policy script. Comments left after the last statement are the program's inner comments.
 */
public record Program(SourceLocation loc, Comments comments, List<Statement> body) implements Node {

    public Program {
        comments = Comments.orEmpty(comments);
        body = Nodes.mutable(body);
    }

    public Program(List<Statement> body) {
        this(null, null, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.list("body", body));
    }
}
