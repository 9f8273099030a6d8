package com.vaceline.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vaceline.ast.*;

/**
 * Polymorphic type handling for the node hierarchy. The {@code "type"} property carries
 * the node type name, the same string {@link Node#type()} returns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),

    // Literals
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = MultilineLiteral.class, name = "MultilineLiteral"),
    @JsonSubTypes.Type(value = DurationLiteral.class, name = "DurationLiteral"),
    @JsonSubTypes.Type(value = NumericLiteral.class, name = "NumericLiteral"),

    // Expressions
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = Header.class, name = "Header"),
    @JsonSubTypes.Type(value = Ip.class, name = "Ip"),
    @JsonSubTypes.Type(value = Member.class, name = "Member"),
    @JsonSubTypes.Type(value = ValuePair.class, name = "ValuePair"),
    @JsonSubTypes.Type(value = BooleanExpression.class, name = "BooleanExpression"),
    @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
    @JsonSubTypes.Type(value = FunCallExpression.class, name = "FunCallExpression"),
    @JsonSubTypes.Type(value = ConcatExpression.class, name = "ConcatExpression"),
    @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
    @JsonSubTypes.Type(value = LogicalExpression.class, name = "LogicalExpression"),

    // Statements
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
    @JsonSubTypes.Type(value = IncludeStatement.class, name = "IncludeStatement"),
    @JsonSubTypes.Type(value = ImportStatement.class, name = "ImportStatement"),
    @JsonSubTypes.Type(value = CallStatement.class, name = "CallStatement"),
    @JsonSubTypes.Type(value = DeclareStatement.class, name = "DeclareStatement"),
    @JsonSubTypes.Type(value = AddStatement.class, name = "AddStatement"),
    @JsonSubTypes.Type(value = SetStatement.class, name = "SetStatement"),
    @JsonSubTypes.Type(value = UnsetStatement.class, name = "UnsetStatement"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
    @JsonSubTypes.Type(value = ErrorStatement.class, name = "ErrorStatement"),
    @JsonSubTypes.Type(value = RestartStatement.class, name = "RestartStatement"),
    @JsonSubTypes.Type(value = SyntheticStatement.class, name = "SyntheticStatement"),
    @JsonSubTypes.Type(value = LogStatement.class, name = "LogStatement"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = SubroutineStatement.class, name = "SubroutineStatement"),
    @JsonSubTypes.Type(value = AclStatement.class, name = "AclStatement"),
    @JsonSubTypes.Type(value = BackendStatement.class, name = "BackendStatement"),
    @JsonSubTypes.Type(value = TableStatement.class, name = "TableStatement"),

    // Block entries
    @JsonSubTypes.Type(value = BackendDefinition.class, name = "BackendDefinition"),
    @JsonSubTypes.Type(value = TableDefinition.class, name = "TableDefinition")
})
public abstract class NodeMixin {
}
