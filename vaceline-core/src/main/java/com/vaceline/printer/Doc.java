package com.vaceline.printer;

import java.util.List;

/**
 * Formatting document: a description of output text whose line breaks are decided by
 * {@link DocRenderer} against a width budget. Build documents with {@link Docs}.
 */
public sealed interface Doc {

    record Text(String text) implements Doc {}

    record Concat(List<Doc> parts) implements Doc {}

    /**
     * Rendered flat when the contents fit on the current line, otherwise broken.
     * {@code shouldBreak} is set when the contents hold a hard line and can never be flat.
     */
    record Group(Doc contents, boolean shouldBreak) implements Doc {}

    /** Adds one indentation level to line breaks inside {@code contents}. */
    record Indent(Doc contents) implements Doc {}

    /** A space when flat, a newline when broken. */
    record Line() implements Doc {}

    /** Nothing when flat, a newline when broken. */
    record Softline() implements Doc {}

    /** Always a newline. */
    record Hardline() implements Doc {}

    /** Picks {@code breakContents} or {@code flatContents} depending on how the enclosing group rendered. */
    record IfBreak(Doc breakContents, Doc flatContents) implements Doc {}
}
