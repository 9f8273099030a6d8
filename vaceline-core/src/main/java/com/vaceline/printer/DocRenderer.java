package com.vaceline.printer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Lays a {@link Doc} out as text. Groups are kept flat whenever their contents, together with
 * whatever follows them up to the next possible line break, fit in the remaining width; otherwise
 * their line breaks are expanded. Outer groups are decided before inner ones.
 *
 * <p>All state lives in a single {@link #render} call. Trailing spaces are stripped from every line.</p>
 */
public final class DocRenderer {

    private enum Mode { FLAT, BREAK }

    private record Command(int indent, Mode mode, Doc doc) {}

    private DocRenderer() {
        // Utility class
    }

    public static String render(Doc doc, PrintOptions options) {
        StringBuilder out = new StringBuilder();
        Deque<Command> stack = new ArrayDeque<>();
        stack.push(new Command(0, Mode.BREAK, doc));
        int column = 0;

        while (!stack.isEmpty()) {
            Command cmd = stack.pop();
            Doc current = cmd.doc();

            if (current instanceof Doc.Text text) {
                String value = text.text();
                out.append(value);
                int newline = value.lastIndexOf('\n');
                column = newline < 0 ? column + value.length() : value.length() - newline - 1;
            } else if (current instanceof Doc.Concat concat) {
                for (int i = concat.parts().size() - 1; i >= 0; i--) {
                    stack.push(new Command(cmd.indent(), cmd.mode(), concat.parts().get(i)));
                }
            } else if (current instanceof Doc.Indent indent) {
                stack.push(new Command(cmd.indent() + options.indentWidth(), cmd.mode(), indent.contents()));
            } else if (current instanceof Doc.Group group) {
                if (group.shouldBreak()) {
                    stack.push(new Command(cmd.indent(), Mode.BREAK, group.contents()));
                } else if (cmd.mode() == Mode.FLAT) {
                    stack.push(new Command(cmd.indent(), Mode.FLAT, group.contents()));
                } else {
                    Command flat = new Command(cmd.indent(), Mode.FLAT, group.contents());
                    if (fits(flat, stack, options.printWidth() - column)) {
                        stack.push(flat);
                    } else {
                        stack.push(new Command(cmd.indent(), Mode.BREAK, group.contents()));
                    }
                }
            } else if (current instanceof Doc.IfBreak ifBreak) {
                Doc chosen = cmd.mode() == Mode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents();
                stack.push(new Command(cmd.indent(), cmd.mode(), chosen));
            } else if (current instanceof Doc.Line) {
                if (cmd.mode() == Mode.FLAT) {
                    out.append(' ');
                    column++;
                } else {
                    column = newline(out, cmd.indent());
                }
            } else if (current instanceof Doc.Softline) {
                if (cmd.mode() == Mode.BREAK) {
                    column = newline(out, cmd.indent());
                }
            } else if (current instanceof Doc.Hardline) {
                column = newline(out, cmd.indent());
            }
        }

        trimTrailingSpaces(out);
        return out.toString();
    }

    /**
     * Whether {@code next} can be printed flat within {@code width} columns. Once {@code next} is
     * exhausted the commands still waiting on {@code rest} are measured too, in their own mode,
     * up to the first line break they would produce.
     */
    private static boolean fits(Command next, Deque<Command> rest, int width) {
        Deque<Command> cmds = new ArrayDeque<>();
        cmds.push(next);
        Iterator<Command> restCommands = rest.iterator();
        int remaining = width;

        while (remaining >= 0) {
            if (cmds.isEmpty()) {
                if (!restCommands.hasNext()) {
                    return true;
                }
                cmds.push(restCommands.next());
                continue;
            }

            Command cmd = cmds.pop();
            Doc current = cmd.doc();

            if (current instanceof Doc.Text text) {
                String value = text.text();
                int newline = value.indexOf('\n');
                if (newline >= 0) {
                    return remaining - newline >= 0;
                }
                remaining -= value.length();
            } else if (current instanceof Doc.Concat concat) {
                for (int i = concat.parts().size() - 1; i >= 0; i--) {
                    cmds.push(new Command(cmd.indent(), cmd.mode(), concat.parts().get(i)));
                }
            } else if (current instanceof Doc.Indent indent) {
                cmds.push(new Command(cmd.indent(), cmd.mode(), indent.contents()));
            } else if (current instanceof Doc.Group group) {
                Mode mode = group.shouldBreak() ? Mode.BREAK : cmd.mode();
                cmds.push(new Command(cmd.indent(), mode, group.contents()));
            } else if (current instanceof Doc.IfBreak ifBreak) {
                Doc chosen = cmd.mode() == Mode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents();
                cmds.push(new Command(cmd.indent(), cmd.mode(), chosen));
            } else if (current instanceof Doc.Line) {
                if (cmd.mode() == Mode.BREAK) {
                    return true;
                }
                remaining--;
            } else if (current instanceof Doc.Softline) {
                if (cmd.mode() == Mode.BREAK) {
                    return true;
                }
            } else if (current instanceof Doc.Hardline) {
                return true;
            }
        }
        return false;
    }

    private static int newline(StringBuilder out, int indent) {
        trimTrailingSpaces(out);
        out.append('\n');
        out.append(" ".repeat(indent));
        return indent;
    }

    private static void trimTrailingSpaces(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        out.setLength(end);
    }
}
