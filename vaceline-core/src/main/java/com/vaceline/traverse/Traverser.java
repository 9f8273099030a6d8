package com.vaceline.traverse;

import com.vaceline.ast.Child;
import com.vaceline.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-order, depth-first walk over an AST.
 *
 * <p>A node's children are read after {@link NodeVisitor#entry} returns, so a visitor may splice
 * statements into the node's own lists (for example prepend a statement to a subroutine body) and
 * the inserted nodes are walked too. Inside a list the walk continues after the position of the node
 * it just visited, found again by identity: a sibling inserted after the current node is visited
 * exactly once, one inserted before it is not visited.</p>
 */
public final class Traverser {

    private Traverser() {
        // Utility class
    }

    public static void traverse(Node root, NodeVisitor visitor) {
        walk(root, new ArrayList<>(), visitor);
    }

    private static void walk(Node node, List<Node> path, NodeVisitor visitor) {
        visitor.entry(node, List.copyOf(path));

        path.add(node);
        for (Child slot : node.children()) {
            if (slot instanceof Child.Single single) {
                walk(single.node(), path, visitor);
            } else if (slot instanceof Child.Many many) {
                walkList(many.nodes(), path, visitor);
            }
        }
        path.remove(path.size() - 1);
    }

    private static void walkList(List<? extends Node> nodes, List<Node> path, NodeVisitor visitor) {
        int index = 0;
        while (index < nodes.size()) {
            Node current = nodes.get(index);
            walk(current, path, visitor);

            int at = indexOfIdentity(nodes, current);
            // Removed by its own visit: whatever moved into its slot has not been visited yet
            index = at < 0 ? index : at + 1;
        }
    }

    private static int indexOfIdentity(List<? extends Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
