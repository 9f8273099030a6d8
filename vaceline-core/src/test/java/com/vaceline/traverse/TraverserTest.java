package com.vaceline.traverse;

import com.vaceline.Parser;
import com.vaceline.ast.*;
import com.vaceline.printer.Printer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TraverserTest {

    @Test
    @DisplayName("Nodes are visited in pre-order")
    void testPreOrder() {
        Program program = Parser.parse("set req.http.A = \"1\";\nrestart;");
        List<String> visited = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> visited.add(node.type()));

        assertEquals(List.of(
            "Program",
            "SetStatement", "Member", "Member", "Identifier", "Identifier", "Header", "StringLiteral",
            "RestartStatement"), visited);
    }

    @Test
    @DisplayName("Ancestors run from the root to the parent")
    void testAncestors() {
        Program program = Parser.parse("sub vcl_recv {\n  return(pass);\n}");
        List<List<String>> paths = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> {
            if (node instanceof ReturnStatement) {
                paths.add(ancestors.stream().map(Node::type).toList());
            }
        });

        assertEquals(List.of(List.of("Program", "SubroutineStatement")), paths);
    }

    @Test
    @DisplayName("Ancestor lists are snapshots")
    void testAncestorsSnapshot() {
        Program program = Parser.parse("sub vcl_recv {\n  restart;\n}");
        List<List<Node>> seen = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> seen.add(ancestors));

        assertTrue(seen.get(0).isEmpty(), "Root has no ancestors");
        assertThrows(UnsupportedOperationException.class, () -> seen.get(0).add(program));
    }

    @Test
    @DisplayName("A statement prepended on entry is visited once, before the original body")
    void testPrependOnEntry() {
        Program program = Parser.parse("sub vcl_recv {\n  restart;\n}");
        List<String> visited = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> {
            visited.add(node.type());
            if (node instanceof SubroutineStatement sub) {
                sub.body().add(0, new LogStatement(new StringLiteral("\"entered\"")));
            }
        });

        assertEquals(List.of(
            "Program", "SubroutineStatement", "Identifier",
            "LogStatement", "StringLiteral",
            "RestartStatement"), visited);
    }

    @Test
    @DisplayName("A sibling inserted after the current node is visited")
    void testInsertAfter() {
        Program program = Parser.parse("restart;\nreturn(pass);");
        List<String> visited = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> {
            visited.add(node.type());
            if (node instanceof RestartStatement) {
                Program root = (Program) ancestors.get(0);
                root.body().add(root.body().indexOf(node) + 1, new LogStatement(new StringLiteral("\"after\"")));
            }
        });

        assertEquals(List.of("Program", "RestartStatement", "LogStatement", "StringLiteral", "ReturnStatement"),
            visited);
    }

    @Test
    @DisplayName("A sibling inserted before the current node is not visited")
    void testInsertBefore() {
        Program program = Parser.parse("restart;\nreturn(pass);");
        List<String> visited = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> {
            visited.add(node.type());
            if (node instanceof ReturnStatement) {
                Program root = (Program) ancestors.get(0);
                root.body().add(root.body().indexOf(node), new LogStatement(new StringLiteral("\"before\"")));
            }
        });

        assertEquals(List.of("Program", "RestartStatement", "ReturnStatement"), visited);
        assertEquals(3, program.body().size());
    }

    @Test
    @DisplayName("Removing the current node does not skip its next sibling")
    void testRemoveCurrent() {
        Program program = Parser.parse("restart;\nreturn(pass);");
        List<String> visited = new ArrayList<>();

        Traverser.traverse(program, (node, ancestors) -> {
            visited.add(node.type());
            if (node instanceof RestartStatement) {
                ((Program) ancestors.get(0)).body().remove(node);
            }
        });

        assertEquals(List.of("Program", "RestartStatement", "ReturnStatement"), visited);
        assertEquals(1, program.body().size());
    }

    @Test
    @DisplayName("Branch logging rewrite instruments subroutines and branches")
    void testBranchLogRewrite() {
        Program program = Parser.parse(String.join("\n",
            "sub vcl_recv {",
            "  if (req.http.host) {",
            "    set req.backend = F_origin;",
            "  }",
            "}"));

        BranchLogRewrite.apply(program);

        assertEquals(String.join("\n",
            "sub vcl_recv {",
            "  add req.http.Branch-Log = \"vcl_recv\";",
            "  if (req.http.host) {",
            "    add req.http.Branch-Log = \"2:3\";",
            "    set req.backend = F_origin;",
            "  }",
            "}",
            ""), Printer.print(program));
    }

    @Test
    @DisplayName("Every branch of an else-if chain is instrumented")
    void testBranchLogElseIf() {
        Program program = Parser.parse(String.join("\n",
            "sub vcl_deliver {",
            "  if (a) {",
            "    restart;",
            "  } elsif (b) {",
            "    restart;",
            "  }",
            "}"));

        BranchLogRewrite.apply(program);

        assertEquals(String.join("\n",
            "sub vcl_deliver {",
            "  set resp.http.Branch-Log = req.http.Branch-Log;",
            "  if (a) {",
            "    add req.http.Branch-Log = \"2:3\";",
            "    restart;",
            "  } else if (b) {",
            "    add req.http.Branch-Log = \"4:5\";",
            "    restart;",
            "  }",
            "}",
            ""), Printer.print(program));
    }

    @Test
    @DisplayName("Synthesized branches are logged as synthetic")
    void testBranchLogSynthetic() {
        Program program = new Program(List.of(
            new SubroutineStatement(new Identifier("vcl_miss"), List.of(
                new IfStatement(new Identifier("a"), List.of())))));

        BranchLogRewrite.apply(program);

        IfStatement branch = (IfStatement) ((SubroutineStatement) program.body().get(0)).body().get(1);
        AddStatement log = (AddStatement) branch.consequent().get(0);
        assertEquals(new StringLiteral("\"synthetic\""), log.right());
    }
}
