package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * Conditional. At most one of {@code alternate} (an {@code else if} chain) and {@code alternateBody}
 * (a terminal {@code else} block) is set; both are null for a bare {@code if}.
 */
public record IfStatement(
    SourceLocation loc,
    Comments comments,
    Expression test,
    List<Statement> consequent,
    IfStatement alternate,  // Can be null
    List<Statement> alternateBody  // Can be null
) implements Statement {

    public IfStatement {
        comments = Comments.orEmpty(comments);
        Objects.requireNonNull(test, "test");
        consequent = Nodes.mutable(consequent);
        if (alternate != null && alternateBody != null) {
            throw new IllegalArgumentException("IfStatement cannot have both an else-if chain and an else block");
        }
        if (alternateBody != null) {
            alternateBody = Nodes.mutable(alternateBody);
        }
    }

    public IfStatement(Expression test, List<Statement> consequent) {
        this(null, null, test, consequent, null, null);
    }

    public IfStatement(Expression test, List<Statement> consequent, IfStatement alternate) {
        this(null, null, test, consequent, alternate, null);
    }

    public IfStatement(Expression test, List<Statement> consequent, List<Statement> alternateBody) {
        this(null, null, test, consequent, null, alternateBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_STATEMENT;
    }

    @Override
    public List<Child> children() {
        return Child.slots(
            Child.node("test", test),
            Child.list("consequent", consequent),
            Child.node("alternate", alternate),
            Child.list("alternateBody", alternateBody));
    }
}
