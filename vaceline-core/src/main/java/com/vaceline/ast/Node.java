package com.vaceline.ast;

import java.util.List;

/**
 * Base interface for all VCL AST nodes
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    BackendDefinition,
    TableDefinition {

    NodeKind kind();

    /**
     * Source span, or {@code null} for nodes synthesized by a rewrite.
     */
    SourceLocation loc();

    /**
     * Ordered structural children. Scalar fields (operators, names, raw literal text) are not children.
     */
    List<Child> children();

    default String type() {
        return kind().typeName();
    }
}
