package com.vaceline.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A structural child slot of a node: either a single node or an ordered list of nodes.
 *
 * <p>{@link Many#nodes()} is the node's own list, so a rewrite may splice into it.</p>
 */
public sealed interface Child {

    String name();

    record Single(String name, Node node) implements Child {}

    record Many(String name, List<? extends Node> nodes) implements Child {}

    static Child node(String name, Node node) {
        return new Single(name, node);
    }

    static Child list(String name, List<? extends Node> nodes) {
        return new Many(name, nodes);
    }

    /**
     * Collects slots in order, skipping absent optional children.
     */
    static List<Child> slots(Child... slots) {
        List<Child> result = new ArrayList<>(slots.length);
        for (Child slot : slots) {
            if (slot instanceof Single single && single.node() == null) continue;
            if (slot instanceof Many many && many.nodes() == null) continue;
            result.add(slot);
        }
        return result;
    }
}
