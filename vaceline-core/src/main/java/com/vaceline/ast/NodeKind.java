package com.vaceline.ast;

public enum NodeKind {
    PROGRAM("Program"),

    BOOLEAN_LITERAL("BooleanLiteral"),
    STRING_LITERAL("StringLiteral"),
    MULTILINE_LITERAL("MultilineLiteral"),
    DURATION_LITERAL("DurationLiteral"),
    NUMERIC_LITERAL("NumericLiteral"),

    IDENTIFIER("Identifier"),
    HEADER("Header"),
    IP("Ip"),
    MEMBER("Member"),
    VALUE_PAIR("ValuePair"),
    BOOLEAN_EXPRESSION("BooleanExpression"),
    UNARY_EXPRESSION("UnaryExpression"),
    FUN_CALL_EXPRESSION("FunCallExpression"),
    CONCAT_EXPRESSION("ConcatExpression"),
    BINARY_EXPRESSION("BinaryExpression"),
    LOGICAL_EXPRESSION("LogicalExpression"),

    EXPRESSION_STATEMENT("ExpressionStatement"),
    INCLUDE_STATEMENT("IncludeStatement"),
    IMPORT_STATEMENT("ImportStatement"),
    CALL_STATEMENT("CallStatement"),
    DECLARE_STATEMENT("DeclareStatement"),
    ADD_STATEMENT("AddStatement"),
    SET_STATEMENT("SetStatement"),
    UNSET_STATEMENT("UnsetStatement"),
    RETURN_STATEMENT("ReturnStatement"),
    ERROR_STATEMENT("ErrorStatement"),
    RESTART_STATEMENT("RestartStatement"),
    SYNTHETIC_STATEMENT("SyntheticStatement"),
    LOG_STATEMENT("LogStatement"),
    IF_STATEMENT("IfStatement"),
    SUBROUTINE_STATEMENT("SubroutineStatement"),
    ACL_STATEMENT("AclStatement"),
    BACKEND_STATEMENT("BackendStatement"),
    TABLE_STATEMENT("TableStatement"),

    BACKEND_DEFINITION("BackendDefinition"),
    TABLE_DEFINITION("TableDefinition");

    private final String typeName;

    NodeKind(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static NodeKind fromTypeName(String typeName) {
        for (NodeKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node type '" + typeName + "'");
    }
}
