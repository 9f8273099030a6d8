package com.vaceline.ast;

import java.util.List;

/**
 * Literals keep their raw source text, quotes and unit suffixes included.
 */
public sealed interface Literal extends Expression permits
    BooleanLiteral,
    StringLiteral,
    MultilineLiteral,
    DurationLiteral,
    NumericLiteral {

    String value();

    @Override
    default List<Child> children() {
        return List.of();
    }
}
