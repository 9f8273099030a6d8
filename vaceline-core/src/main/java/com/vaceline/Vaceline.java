package com.vaceline;

import com.vaceline.ast.Node;
import com.vaceline.ast.Program;
import com.vaceline.printer.PrintOptions;
import com.vaceline.printer.Printer;
import com.vaceline.traverse.NodeVisitor;
import com.vaceline.traverse.Traverser;

import java.util.logging.Logger;

/**
 * Entry points for tooling: parse source into a {@link Program}, rewrite it through
 * {@link #traverse}, and print it back.
 *
 * <pre>{@code
 * Program program = Vaceline.parse(source);
 * Vaceline.traverse(program, (node, ancestors) -> { ... });
 * String formatted = Vaceline.print(program);
 * }</pre>
 */
public final class Vaceline {

    private static final Logger logger = Logger.getLogger(Vaceline.class.getName());

    private Vaceline() {
        // Utility class
    }

    /**
     * @throws ParseException at the first syntax error
     */
    public static Program parse(String source) {
        long start = System.nanoTime();
        Program program = Parser.parse(source);
        logger.fine(() -> String.format("Parsed %d statements in %dms",
            program.body().size(), (System.nanoTime() - start) / 1_000_000));
        return program;
    }

    public static String print(Node node) {
        return print(node, PrintOptions.DEFAULT);
    }

    public static String print(Node node, PrintOptions options) {
        long start = System.nanoTime();
        String text = Printer.print(node, options);
        logger.fine(() -> String.format("Printed %s in %dms", node.type(), (System.nanoTime() - start) / 1_000_000));
        return text;
    }

    /**
     * Parses and reprints {@code source} in canonical form.
     *
     * @throws ParseException at the first syntax error
     */
    public static String format(String source) {
        return print(parse(source));
    }

    public static String format(String source, PrintOptions options) {
        return print(parse(source), options);
    }

    public static void traverse(Node root, NodeVisitor visitor) {
        Traverser.traverse(root, visitor);
    }
}
