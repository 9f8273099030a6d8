package com.vaceline.printer;

import com.vaceline.Parser;
import com.vaceline.TestObjectMapper;
import com.vaceline.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private static String format(String source) {
        return Printer.print(Parser.parse(source));
    }

    private static String format(String source, int width) {
        return Printer.print(Parser.parse(source), PrintOptions.DEFAULT.withPrintWidth(width));
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    // Condition of the if statement that the printed expression is parsed back as
    private static Expression reparse(String expression) {
        IfStatement branch = (IfStatement) Parser.parse("if (" + expression + ") {}").body().get(0);
        return branch.test();
    }

    // Drops the groups that parentheses parse into, leaving only the operator nesting
    private static Expression ungroup(Expression node) {
        if (node instanceof BooleanExpression group) {
            return ungroup(group.body());
        }
        if (node instanceof BinaryExpression binary) {
            return new BinaryExpression(ungroup(binary.left()), binary.operator(), ungroup(binary.right()));
        }
        if (node instanceof LogicalExpression logical) {
            return new LogicalExpression(ungroup(logical.left()), logical.operator(), ungroup(logical.right()));
        }
        if (node instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.operator(), ungroup(unary.argument()));
        }
        if (node instanceof ConcatExpression concat) {
            return new ConcatExpression(concat.body().stream().map(PrinterTest::ungroup).toList());
        }
        return node;
    }

    private static void assertPrintsAs(String expected, Expression expression) {
        String printed = Printer.print(expression);
        assertEquals(expected, printed);
        TestObjectMapper.assertSameStructure(expression, ungroup(reparse(printed)));
        assertEquals(printed, Printer.print(reparse(printed)));
    }

    // ==================== Statements ====================

    @Test
    @DisplayName("Subroutine bodies are indented one statement per line")
    void testSubroutineLayout() {
        assertEquals("""
            sub vcl_recv {
              set req.http.X = "1";
              if (req.http.Y) {
                return (pass);
              }
            }
            """, format("sub vcl_recv{set req.http.X=\"1\";if(req.http.Y){return(pass);}}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "import std;\n",
        "include \"shared.vcl\";\n",
        "call vcl_hash;\n",
        "declare local var.region STRING;\n",
        "add resp.http.Set-Cookie = \"a=b\";\n",
        "set var.n += 1;\n",
        "set req.http.Cookie:session = \"1\";\n",
        "unset req.http.Cookie;\n",
        "return (lookup);\n",
        "error 404 \"Not found\";\n",
        "error 503;\n",
        "restart;\n",
        "synthetic {\"<html>oops</html>\"};\n",
        "log \"syslog \" req.service_id \" :: \" req.url;\n",
        "esi;\n",
        "set var.t = -1;\n",
        "set var.n = 0.5;\n",
        "set beresp.ttl = 35s;\n",
        "set x = std.strcat(\"a\", \"b\");\n",
        "set x = now();\n",
    })
    @DisplayName("Canonical statements print unchanged")
    void testCanonicalStatements(String source) {
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Return without parentheses gains them")
    void testReturnNormalized() {
        assertEquals("return (pass);\n", format("return pass;"));
    }

    @Test
    @DisplayName("Explicit + between concatenated values is dropped")
    void testConcatNormalized() {
        assertEquals("set x = \"a\" req.url \"b\";\n", format("set x = \"a\" + req.url + \"b\";"));
    }

    @Test
    @DisplayName("else if, elsif and elseif print as else if")
    void testIfChain() {
        assertEquals("""
            if (a) {
              restart;
            } else if (b) {
              restart;
            } else {
              restart;
            }
            """, format("if (a) { restart; } elsif (b) { restart; } else { restart; }"));
    }

    @Test
    @DisplayName("Empty blocks keep the closing brace on its own line")
    void testEmptyBlock() {
        assertEquals("sub vcl_hit {\n}\n", format("sub vcl_hit {}"));
        assertEquals("if (a) {\n}\n", format("if (a) {}"));
    }

    @Test
    @DisplayName("ACL entries")
    void testAcl() {
        String source = """
            acl office {
              "10.0.0.0"/8;
              "192.168.1.1";
            }
            """;
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Backends print nested blocks without a closing semicolon")
    void testBackend() {
        assertEquals("""
            backend F_origin {
              .host = "example.com";
              .probe = {
                .threshold = 1;
              }
            }
            """, format("backend F_origin { .host = \"example.com\"; .probe = { .threshold = 1; }; }"));
    }

    @Test
    @DisplayName("Table entries are comma separated without a trailing comma")
    void testTable() {
        assertEquals("""
            table redirects {
              "/old": "/new",
              "/a": "/b"
            }
            """, format("table redirects {\n\"/old\":\"/new\",\"/a\":\"/b\",}"));
    }

    // ==================== Spacing ====================

    @Test
    @DisplayName("Blank lines between statements are preserved")
    void testBlankLines() {
        String source = "set a = 1;\n\n\nset b = 2;\nset c = 3;\n";
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Blank lines are measured to the first leading comment")
    void testBlankLinesBeforeComment() {
        String source = "set a = 1;\n\n# about b\nset b = 2;\n";
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Blank lines between leading comments are preserved")
    void testBlankLinesBetweenComments() {
        String source = "# a\n\n# b\nset a = 1;\n";
        assertEquals(source, format(source));

        String spaced = "/* header\n */\n\n\n# about a\n\nset a = 1;\n";
        assertEquals(spaced, format(spaced));
    }

    @Test
    @DisplayName("A trailing comment spanning lines does not add blank lines below it")
    void testMultilineTrailingComment() {
        String source = "set a = 1; /* x\n y */\nset b = 2;\n";
        assertEquals(source, format(source));
        assertEquals(source, format(format(source)));

        String spaced = "set a = 1; /* x\n y */\n\nset b = 2;\n";
        assertEquals(spaced, format(spaced));
    }

    @Test
    @DisplayName("Blank lines inside blocks are preserved")
    void testBlankLinesInBlock() {
        String source = """
            sub vcl_recv {
              set a = 1;

              set b = 2;
            }
            """;
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Statements without a location follow their predecessor directly")
    void testSynthesizedStatements() {
        Program program = Parser.parse("restart;\n\nreturn (pass);\n");
        program.body().add(1, new LogStatement(new StringLiteral("\"x\"")));

        assertEquals("restart;\nlog \"x\";\n\nreturn (pass);\n", Printer.print(program));
    }

    @Test
    @DisplayName("A fully synthesized tree prints")
    void testSynthesizedProgram() {
        Program program = new Program(List.of(
            new SubroutineStatement(new Identifier("vcl_recv"), List.of(
                new SetStatement(
                    new Member(new Member(new Identifier("req"), new Identifier("http")), new Header("X")),
                    "=",
                    new StringLiteral("\"1\"")),
                new ReturnStatement(null, null, "pass")))));

        assertEquals("""
            sub vcl_recv {
              set req.http.X = "1";
              return (pass);
            }
            """, Printer.print(program));
    }

    // ==================== Comments ====================

    @Test
    @DisplayName("Leading and trailing comments are printed")
    void testComments() {
        String source = """
            # leading
            set a = 1; # trailing
            /* block
               comment */
            restart;
            """;
        assertEquals(source, format(source));
    }

    @Test
    @DisplayName("Inner comments are not printed")
    void testInnerCommentsDropped() {
        assertEquals("set a = 1;\n", format("set a = /* inner */ 1;"));
        assertEquals("sub vcl_recv {\n  restart;\n}\n", format("sub vcl_recv {\n  restart;\n  # dangling\n}"));
    }

    @Test
    @DisplayName("Comment-only source prints nothing")
    void testEmptyProgram() {
        assertEquals("", format(""));
        assertEquals("", format("# only a comment\n"));
    }

    // ==================== Expressions ====================

    @Test
    @DisplayName("Nested comparison on the left is parenthesized")
    void testBinaryParentheses() {
        assertEquals("if ((a == b) == c) {\n}\n", format("if (a == b == c) {}"));
        assertEquals("if (a == (b == c)) {\n}\n", format("if (a == (b == c)) {}"));
    }

    @Test
    @DisplayName("&& under || is parenthesized")
    void testLogicalParentheses() {
        assertEquals("if ((a && b) || c) {\n}\n", format("if (a && b || c) {}"));
        assertEquals("if (a || (b && c)) {\n}\n", format("if (a || b && c) {}"));
        assertEquals("if (a || b || c) {\n}\n", format("if (a || b || c) {}"));
        assertEquals("if ((a || b) && c) {\n}\n", format("if ((a || b) && c) {}"));
    }

    @Test
    @DisplayName("Built trees print with the parentheses their nesting needs")
    void testSynthesizedParentheses() {
        assertPrintsAs("(a || b) && c",
            new LogicalExpression(new LogicalExpression(id("a"), "||", id("b")), "&&", id("c")));
        assertPrintsAs("a || (b || c)",
            new LogicalExpression(id("a"), "||", new LogicalExpression(id("b"), "||", id("c"))));
        assertPrintsAs("(a && b) == c",
            new BinaryExpression(new LogicalExpression(id("a"), "&&", id("b")), "==", id("c")));
        assertPrintsAs("a == (b == c)",
            new BinaryExpression(id("a"), "==", new BinaryExpression(id("b"), "==", id("c"))));
        assertPrintsAs("!(a == b)",
            new UnaryExpression("!", new BinaryExpression(id("a"), "==", id("b"))));
        assertPrintsAs("!(a && b)",
            new UnaryExpression("!", new LogicalExpression(id("a"), "&&", id("b"))));
    }

    @Test
    @DisplayName("Built concatenations are parenthesized inside operators")
    void testSynthesizedConcatParentheses() {
        ConcatExpression xy = new ConcatExpression(List.of(new StringLiteral("\"x\""), new StringLiteral("\"y\"")));

        assertPrintsAs("a == (\"x\" \"y\")", new BinaryExpression(id("a"), "==", xy));
        assertPrintsAs("(\"x\" \"y\") || a", new LogicalExpression(xy, "||", id("a")));
        assertPrintsAs("\"a\" (!b)",
            new ConcatExpression(List.of(new StringLiteral("\"a\""), new UnaryExpression("!", id("b")))));
        assertPrintsAs("a == b \"x\"",
            new ConcatExpression(List.of(new BinaryExpression(id("a"), "==", id("b")), new StringLiteral("\"x\""))));
    }

    @Test
    @DisplayName("Unary and value pair expressions")
    void testUnaryAndValuePair() {
        assertEquals("if (!req.http.Cookie:session) {\n}\n", format("if (!req.http.Cookie:session) {}"));
    }

    @Test
    @DisplayName("Expressions print on their own without a trailing newline")
    void testExpressionNode() {
        Expression expression = new BinaryExpression(new Identifier("a"), "==", new StringLiteral("\"b\""));
        assertEquals("a == \"b\"", Printer.print(expression));
    }

    // ==================== Line breaking ====================

    @Test
    @DisplayName("Long call arguments go one per line with a trailing comma")
    void testFunCallBreaks() {
        String source = "log std.strcat(\"aaaaaaaaaa\", \"bbbbbbbbbb\", \"cccccccccc\");";
        assertEquals("""
            log std.strcat(
              "aaaaaaaaaa",
              "bbbbbbbbbb",
              "cccccccccc",
            );
            """, format(source, 30));
        assertEquals(source + "\n", format(source));
    }

    @Test
    @DisplayName("Long assignments break after the operator, keeping members whole")
    void testAssignmentBreaks() {
        assertEquals("set req.http.X-Very-Long =\n  req.http.Other;\n",
            format("set req.http.X-Very-Long = req.http.Other;", 20));
    }

    @Test
    @DisplayName("Long conditions break inside the parentheses and along the member chain")
    void testConditionBreaks() {
        assertEquals("""
            if (
              req.http.aaaaaaaa
                .bbbbbbbb
            ) {
            }
            """, format("if (req.http.aaaaaaaa.bbbbbbbb) {}", 20));
    }

    @Test
    @DisplayName("Broken output parses back to the same tree")
    void testBrokenOutputReparses() {
        String source = "log std.strcat(\"aaaaaaaaaa\", \"bbbbbbbbbb\", \"cccccccccc\");";
        String narrow = format(source, 30);
        assertEquals(narrow, format(narrow, 30));
        assertEquals(source + "\n", format(narrow));
    }
}
