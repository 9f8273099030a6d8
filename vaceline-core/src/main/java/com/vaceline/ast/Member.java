package com.vaceline.ast;

import java.util.List;
import java.util.Objects;

/**
 * Left-nested property access: {@code a.b.c} is {@code Member(Member(a, b), c)}.
 */
public record Member(SourceLocation loc, Expression base, Expression member) implements Expression {

    public Member {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(member, "member");
    }

    public Member(Expression base, Expression member) {
        this(null, base, member);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MEMBER;
    }

    @Override
    public List<Child> children() {
        return Child.slots(Child.node("base", base), Child.node("member", member));
    }
}
