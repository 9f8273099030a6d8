package com.vaceline.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    IncludeStatement,
    ImportStatement,
    CallStatement,
    DeclareStatement,
    AddStatement,
    SetStatement,
    UnsetStatement,
    ReturnStatement,
    ErrorStatement,
    RestartStatement,
    SyntheticStatement,
    LogStatement,
    IfStatement,
    SubroutineStatement,
    AclStatement,
    BackendStatement,
    TableStatement {

    Comments comments();
}
