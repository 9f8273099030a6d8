package com.vaceline.printer;

import com.vaceline.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.vaceline.printer.Docs.*;

/**
 * Renders an AST back into formatted VCL.
 *
 * <p>Statement lists keep the author's blank lines, read from the statements' source locations;
 * synthesized statements without a location follow their predecessor directly. Leading comments
 * are printed on the lines before a statement and trailing comments after it on the same line.
 * Inner comments are not printed.</p>
 */
public final class Printer {

    private static final Logger logger = Logger.getLogger(Printer.class.getName());

    // Operand precedence, loosest first; an operand looser than its position allows is parenthesized
    private static final int PREC_CONCAT = 0;
    private static final int PREC_OR = 1;
    private static final int PREC_AND = 2;
    private static final int PREC_COMPARISON = 3;
    private static final int PREC_UNARY = 4;
    private static final int PREC_PRIMARY = 5;

    private Printer() {
        // Utility class
    }

    public static String print(Node node) {
        return print(node, PrintOptions.DEFAULT);
    }

    public static String print(Node node, PrintOptions options) {
        String text = DocRenderer.render(toDoc(node), options);
        if (node instanceof Program && !text.isEmpty() && !text.endsWith("\n")) {
            return text + "\n";
        }
        return text;
    }

    /**
     * Builds the document for {@code node} without laying it out.
     */
    public static Doc toDoc(Node node) {
        switch (node.kind()) {
            case PROGRAM: {
                Program program = (Program) node;
                reportInnerComments(program, program.comments());
                return statements(program.body());
            }
            case BACKEND_DEFINITION:
                return backendDefinition((BackendDefinition) node);
            case TABLE_DEFINITION:
                return tableDefinition((TableDefinition) node);
            default:
                if (node instanceof Statement statement) {
                    return statement(statement);
                }
                return expression((Expression) node);
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private static Doc statements(List<Statement> body) {
        List<Doc> parts = new ArrayList<>();
        Integer previousEnd = null;

        for (Statement stmt : body) {
            if (!parts.isEmpty()) {
                parts.add(hardline());
                Integer start = startLine(stmt);
                if (previousEnd != null && start != null) {
                    for (int blank = start - previousEnd - 1; blank > 0; blank--) {
                        parts.add(hardline());
                    }
                }
            }
            parts.add(statement(stmt));
            if (stmt.loc() != null) {
                previousEnd = endLine(stmt);
            }
        }
        return concat(parts);
    }

    // Last source line a statement occupies, trailing comments included
    private static int endLine(Statement stmt) {
        int line = stmt.loc().end().line();
        for (Comment comment : stmt.comments().trailing()) {
            if (comment.loc() != null) {
                line = Math.max(line, comment.loc().end().line());
            }
        }
        return line;
    }

    // First source line a statement occupies, leading comments included
    private static Integer startLine(Statement stmt) {
        if (stmt.loc() == null) {
            return null;
        }
        int line = stmt.loc().start().line();
        for (Comment comment : stmt.comments().leading()) {
            if (comment.loc() != null) {
                line = Math.min(line, comment.loc().start().line());
            }
        }
        return line;
    }

    private static Doc statement(Statement stmt) {
        Doc printed = statementBody(stmt);
        Comments comments = stmt.comments();
        reportInnerComments(stmt, comments);

        if (!comments.leading().isEmpty()) {
            printed = concat(leadingComments(stmt, comments.leading()), printed);
        }
        if (!comments.trailing().isEmpty()) {
            printed = concat(printed, text(" "), join(text(" "), commentTexts(comments.trailing())));
        }
        return printed;
    }

    private static Doc statementBody(Statement stmt) {
        switch (stmt.kind()) {
            case EXPRESSION_STATEMENT:
                return concat(expression(((ExpressionStatement) stmt).body()), text(";"));
            case INCLUDE_STATEMENT:
                return concat(text("include "), expression(((IncludeStatement) stmt).module()), text(";"));
            case IMPORT_STATEMENT:
                return concat(text("import "), expression(((ImportStatement) stmt).module()), text(";"));
            case CALL_STATEMENT:
                return concat(text("call "), expression(((CallStatement) stmt).subroutine()), text(";"));
            case DECLARE_STATEMENT: {
                DeclareStatement declare = (DeclareStatement) stmt;
                return concat(text("declare local "), expression(declare.id(), true), text(" "),
                    text(declare.valueType()), text(";"));
            }
            case ADD_STATEMENT: {
                AddStatement add = (AddStatement) stmt;
                return group(indent(text("add "), expression(add.left(), true), text(" "), text(add.operator()),
                    line(), expression(add.right()), text(";")));
            }
            case SET_STATEMENT: {
                SetStatement set = (SetStatement) stmt;
                return group(indent(text("set "), expression(set.left(), true), text(" "), text(set.operator()),
                    line(), expression(set.right(), true), text(";")));
            }
            case UNSET_STATEMENT:
                return concat(text("unset "), expression(((UnsetStatement) stmt).id(), true), text(";"));
            case RETURN_STATEMENT:
                return text("return (" + ((ReturnStatement) stmt).action() + ");");
            case ERROR_STATEMENT: {
                ErrorStatement error = (ErrorStatement) stmt;
                List<Doc> words = new ArrayList<>();
                words.add(text("error"));
                words.add(expression(error.status()));
                if (error.message() != null) {
                    words.add(expression(error.message()));
                }
                return concat(join(text(" "), words), text(";"));
            }
            case RESTART_STATEMENT:
                return text("restart;");
            case SYNTHETIC_STATEMENT:
                return concat(text("synthetic "), expression(((SyntheticStatement) stmt).response()), text(";"));
            case LOG_STATEMENT:
                return concat(text("log "), expression(((LogStatement) stmt).content()), text(";"));
            case IF_STATEMENT:
                return ifStatement((IfStatement) stmt);
            case SUBROUTINE_STATEMENT: {
                SubroutineStatement sub = (SubroutineStatement) stmt;
                return concat(text("sub "), expression(sub.id()), text(" "), block(sub.body()));
            }
            case ACL_STATEMENT: {
                AclStatement acl = (AclStatement) stmt;
                List<Doc> entries = new ArrayList<>();
                for (Ip ip : acl.body()) {
                    entries.add(concat(expression(ip), text(";")));
                }
                return concat(text("acl "), expression(acl.id()), text(" "), braced(entries, hardline()));
            }
            case BACKEND_STATEMENT: {
                BackendStatement backend = (BackendStatement) stmt;
                return concat(text("backend "), expression(backend.id()), text(" "), backendBlock(backend.body()));
            }
            case TABLE_STATEMENT: {
                TableStatement table = (TableStatement) stmt;
                List<Doc> entries = new ArrayList<>();
                for (TableDefinition definition : table.body()) {
                    entries.add(tableDefinition(definition));
                }
                return concat(text("table "), expression(table.id()), text(" "),
                    braced(entries, concat(text(","), hardline())));
            }
            default:
                throw new IllegalStateException("Not a statement: " + stmt.type());
        }
    }

    private static Doc ifStatement(IfStatement node) {
        List<Doc> parts = new ArrayList<>();
        parts.add(text("if "));
        parts.add(group(
            indent(text("("), ifBreak(hardline(), EMPTY), expression(node.test())),
            ifBreak(hardline(), EMPTY),
            text(") ")));
        parts.add(block(node.consequent()));

        if (node.alternate() != null) {
            reportInnerComments(node.alternate(), node.alternate().comments());
            parts.add(text(" else "));
            parts.add(ifStatement(node.alternate()));
        } else if (node.alternateBody() != null) {
            parts.add(text(" else "));
            parts.add(block(node.alternateBody()));
        }
        return concat(parts);
    }

    private static Doc block(List<Statement> body) {
        if (body.isEmpty()) {
            return concat(text("{"), hardline(), text("}"));
        }
        return concat(text("{"), indent(hardline(), statements(body)), hardline(), text("}"));
    }

    private static Doc braced(List<Doc> entries, Doc separator) {
        if (entries.isEmpty()) {
            return concat(text("{"), hardline(), text("}"));
        }
        return concat(text("{"), indent(hardline(), join(separator, entries)), hardline(), text("}"));
    }

    private static Doc backendBlock(List<BackendDefinition> body) {
        List<Doc> entries = new ArrayList<>();
        for (BackendDefinition definition : body) {
            entries.add(backendDefinition(definition));
        }
        return braced(entries, hardline());
    }

    private static Doc backendDefinition(BackendDefinition node) {
        Doc value = node.body() != null
            ? backendBlock(node.body())
            : concat(expression(node.value()), text(";"));
        return concat(text("." + node.key() + " = "), value);
    }

    private static Doc tableDefinition(TableDefinition node) {
        return text(node.key() + ": " + node.value());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static Doc expression(Expression node) {
        return expression(node, false);
    }

    /**
     * @param neverBreak keep a member chain on one line (assignment targets and values)
     */
    private static Doc expression(Expression node, boolean neverBreak) {
        switch (node.kind()) {
            case BOOLEAN_LITERAL:
            case STRING_LITERAL:
            case MULTILINE_LITERAL:
            case DURATION_LITERAL:
            case NUMERIC_LITERAL:
                return text(((Literal) node).value());
            case IDENTIFIER:
                return text(((Identifier) node).name());
            case HEADER:
                return text(((Header) node).name());
            case IP: {
                Ip ip = (Ip) node;
                String quoted = "\"" + ip.value() + "\"";
                return text(ip.cidr() != null ? quoted + "/" + ip.cidr() : quoted);
            }
            case MEMBER:
                return member((Member) node, neverBreak, false);
            case VALUE_PAIR: {
                ValuePair pair = (ValuePair) node;
                return concat(expression(pair.base()), text(":"), expression(pair.name()));
            }
            case BOOLEAN_EXPRESSION:
                return group(
                    indent(text("("), ifBreak(softline(), EMPTY), expression(((BooleanExpression) node).body())),
                    ifBreak(softline(), EMPTY),
                    text(")"));
            case UNARY_EXPRESSION: {
                UnaryExpression unary = (UnaryExpression) node;
                return concat(text(unary.operator()), operand(unary.argument(), PREC_UNARY));
            }
            case FUN_CALL_EXPRESSION:
                return funCall((FunCallExpression) node);
            case CONCAT_EXPRESSION: {
                List<Doc> parts = new ArrayList<>();
                for (Expression part : ((ConcatExpression) node).body()) {
                    // only the first value may be an operator expression
                    parts.add(operand(part, parts.isEmpty() ? PREC_OR : PREC_PRIMARY));
                }
                return group(indent(join(line(), parts)));
            }
            case BINARY_EXPRESSION:
                return binary((BinaryExpression) node);
            case LOGICAL_EXPRESSION:
                return logical((LogicalExpression) node);
            default:
                throw new IllegalStateException("Not an expression: " + node.type());
        }
    }

    /**
     * Member chains break from the outside in: a member whose base is itself a member, or whose
     * enclosing member already breaks, puts its {@code .name} on a new line when the group breaks.
     */
    private static Doc member(Member node, boolean neverBreak, boolean broken) {
        boolean shouldBreak = !neverBreak && (node.base() instanceof Member || broken);

        Doc base = node.base() instanceof Member inner
            ? member(inner, neverBreak, shouldBreak)
            : expression(node.base());
        return group(
            base,
            indent(shouldBreak ? softline() : EMPTY, text("."), expression(node.member())));
    }

    private static Doc funCall(FunCallExpression node) {
        List<Doc> arguments = new ArrayList<>();
        for (Expression argument : node.arguments()) {
            arguments.add(expression(argument));
        }
        return concat(
            expression(node.callee()),
            text("("),
            group(
                indent(
                    ifBreak(line(), EMPTY),
                    join(concat(text(","), line()), arguments),
                    ifBreak(text(","), EMPTY)),
                ifBreak(line(), EMPTY)),
            text(")"));
    }

    private static Doc binary(BinaryExpression node) {
        // a comparison operand of a comparison is always parenthesized
        Doc left = operand(node.left(), PREC_COMPARISON + 1);
        Doc right = operand(node.right(), PREC_COMPARISON + 1);
        return group(left, text(" "), indent(text(node.operator()), line(), right));
    }

    private static Doc logical(LogicalExpression node) {
        Doc left = logicalOperand(node.left(), node.operator(), false);
        Doc right = logicalOperand(node.right(), node.operator(), true);
        return group(left, text(" "), indent(text(node.operator()), line(), right));
    }

    private static Doc logicalOperand(Expression child, String parentOperator, boolean right) {
        // && inside || is parenthesized on either side
        if (parentOperator.equals("||")
                && child instanceof LogicalExpression nested
                && nested.operator().equals("&&")) {
            return parenthesized(child);
        }
        int parent = precedence(parentOperator);
        return operand(child, right ? parent + 1 : parent);
    }

    private static Doc operand(Expression node, int minPrecedence) {
        return precedence(node) < minPrecedence ? parenthesized(node) : expression(node);
    }

    private static Doc parenthesized(Expression node) {
        return concat(text("("), expression(node), text(")"));
    }

    private static int precedence(Expression node) {
        if (node instanceof ConcatExpression) {
            return PREC_CONCAT;
        }
        if (node instanceof LogicalExpression logical) {
            return precedence(logical.operator());
        }
        if (node instanceof BinaryExpression) {
            return PREC_COMPARISON;
        }
        if (node instanceof UnaryExpression) {
            return PREC_UNARY;
        }
        return PREC_PRIMARY;
    }

    private static int precedence(String logicalOperator) {
        return logicalOperator.equals("||") ? PREC_OR : PREC_AND;
    }

    // ========================================================================
    // Comments
    // ========================================================================

    /**
     * Leading comments one per line, each followed by as many blank lines as separated it from the
     * next comment or from the statement in the source.
     */
    private static Doc leadingComments(Statement stmt, List<Comment> leading) {
        List<Doc> parts = new ArrayList<>();
        for (int i = 0; i < leading.size(); i++) {
            Comment comment = leading.get(i);
            parts.add(text(comment.text()));
            parts.add(hardline());

            Integer nextStart = i + 1 < leading.size()
                ? lineOf(leading.get(i + 1).loc())
                : lineOf(stmt.loc());
            if (comment.loc() != null && nextStart != null) {
                for (int blank = nextStart - comment.loc().end().line() - 1; blank > 0; blank--) {
                    parts.add(hardline());
                }
            }
        }
        return concat(parts);
    }

    private static Integer lineOf(SourceLocation loc) {
        return loc == null ? null : loc.start().line();
    }

    private static List<Doc> commentTexts(List<Comment> comments) {
        List<Doc> texts = new ArrayList<>(comments.size());
        for (Comment comment : comments) {
            texts.add(text(comment.text()));
        }
        return texts;
    }

    private static void reportInnerComments(Node node, Comments comments) {
        if (!comments.inner().isEmpty()) {
            logger.fine(() -> comments.inner().size() + " inner comment(s) of " + node.type()
                + (node.loc() != null ? " at " + node.loc() : "") + " are not printed");
        }
    }
}
