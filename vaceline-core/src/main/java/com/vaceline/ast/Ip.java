package com.vaceline.ast;

import java.util.List;

/**
 * IP literal as written in an ACL. {@code value} is the address without quotes; {@code cidr} may be null.
 */
public record Ip(SourceLocation loc, String value, Integer cidr) implements Expression {

    public Ip(String value, Integer cidr) {
        this(null, value, cidr);
    }

    public Ip(String value) {
        this(null, value, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IP;
    }

    @Override
    public List<Child> children() {
        return List.of();
    }
}
