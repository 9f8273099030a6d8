package com.vaceline.traverse;

import com.vaceline.ast.*;

import java.util.List;
import java.util.Map;

/**
 * Instrumentation rewrite used to exercise traversal: every subroutine starts by recording its
 * name in a {@code Branch-Log} header, and every if branch records the line and column it starts at.
 * {@code vcl_deliver} copies the collected log onto the response instead.
 */
final class BranchLogRewrite implements NodeVisitor {

    static void apply(Node root) {
        Traverser.traverse(root, new BranchLogRewrite());
    }

    @Override
    public void entry(Node node, List<Node> ancestors) {
        if (node instanceof SubroutineStatement sub) {
            Statement logger = sub.id().name().equals("vcl_deliver")
                ? (Statement) Nodes.build(NodeKind.SET_STATEMENT, Map.of(
                    "left", branchLog("resp"),
                    "operator", "=",
                    "right", branchLog("req")))
                : (Statement) Nodes.build(NodeKind.ADD_STATEMENT, Map.of(
                    "left", branchLog("req"),
                    "operator", "=",
                    "right", quoted(sub.id().name())));
            sub.body().add(0, logger);
        } else if (node instanceof IfStatement branch) {
            String position = branch.loc() != null
                ? branch.loc().start().line() + ":" + branch.loc().start().column()
                : "synthetic";
            branch.consequent().add(0, new AddStatement(null, null, branchLog("req"), "=", quoted(position)));
        }
    }

    private static Member branchLog(String object) {
        return new Member(new Member(new Identifier(object), new Identifier("http")), new Header("Branch-Log"));
    }

    private static StringLiteral quoted(String value) {
        return new StringLiteral("\"" + value + "\"");
    }
}
