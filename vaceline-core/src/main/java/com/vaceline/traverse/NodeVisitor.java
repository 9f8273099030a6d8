package com.vaceline.traverse;

import com.vaceline.ast.Node;

import java.util.List;

/**
 * Callback invoked by {@link Traverser} for every node, before its children are walked.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * @param node the node being entered
     * @param ancestors the path from the root to the parent of {@code node}, root first; empty for the root
     */
    void entry(Node node, List<Node> ancestors);
}
