package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record ImportStatement(SourceLocation loc, Comments comments, Identifier module) implements Statement {

    public ImportStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(module, "module");
    }

    public ImportStatement(Identifier module) {
        this(null, null, module);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("module", module));
    }
}
