package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

public record IncludeStatement(SourceLocation loc, Comments comments, StringLiteral module) implements Statement {

    public IncludeStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(module, "module");
    }

    public IncludeStatement(StringLiteral module) {
        this(null, null, module);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INCLUDE_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("module", module));
    }
}
