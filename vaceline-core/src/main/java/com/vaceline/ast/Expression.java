package com.vaceline.ast;

public sealed interface Expression extends Node permits
    Literal,
    Identifier,
    Header,
    Ip,
    Member,
    ValuePair,
    BooleanExpression,
    UnaryExpression,
    FunCallExpression,
    ConcatExpression,
    BinaryExpression,
    LogicalExpression {
}
