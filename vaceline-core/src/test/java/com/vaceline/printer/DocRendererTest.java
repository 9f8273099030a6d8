package com.vaceline.printer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.vaceline.printer.Docs.*;
import static org.junit.jupiter.api.Assertions.*;

public class DocRendererTest {

    private static String render(Doc doc, int width) {
        return DocRenderer.render(doc, PrintOptions.DEFAULT.withPrintWidth(width));
    }

    @Test
    @DisplayName("A group that fits stays flat")
    void testGroupFlat() {
        Doc doc = group(text("a"), line(), text("b"), softline(), text("c"));
        assertEquals("a bc", render(doc, 80));
    }

    @Test
    @DisplayName("A group that does not fit breaks its lines")
    void testGroupBreaks() {
        Doc doc = group(text("a"), line(), text("b"), softline(), text("c"));
        assertEquals("a\nb\nc", render(doc, 3));
    }

    @Test
    @DisplayName("Indentation applies to broken lines inside it")
    void testIndent() {
        Doc doc = group(text("x"), indent(line(), text("y")), line(), text("z"));
        assertEquals("x\n  y\nz", render(doc, 1));
    }

    @Test
    @DisplayName("Indent width comes from the options")
    void testIndentWidth() {
        Doc doc = concat(text("{"), indent(hardline(), text("x")), hardline(), text("}"));
        assertEquals("{\n    x\n}", DocRenderer.render(doc, new PrintOptions(80, 4)));
    }

    @Test
    @DisplayName("A hard line forces its group to break")
    void testHardlineBreaksGroup() {
        Doc doc = group(text("a"), line(), text("b"), hardline(), text("c"));
        assertEquals("a\nb\nc", render(doc, 80));
        assertTrue(((Doc.Group) doc).shouldBreak());
    }

    @Test
    @DisplayName("Breaking propagates out of nested groups but not out of if-break branches")
    void testShouldBreakPropagation() {
        Doc nested = group(text("a"), group(text("b"), hardline()));
        assertTrue(((Doc.Group) nested).shouldBreak());

        Doc conditional = group(text("a"), ifBreak(hardline(), EMPTY));
        assertFalse(((Doc.Group) conditional).shouldBreak());
    }

    @Test
    @DisplayName("If-break picks its branch by the enclosing group's mode")
    void testIfBreak() {
        Doc flat = group(text("["), ifBreak(text("!"), text("?")), text("]"));
        assertEquals("[?]", render(flat, 80));

        Doc broken = group(text("["), ifBreak(text("!"), text("?")), line(), text("]"));
        assertEquals("[!\n]", render(broken, 2));
    }

    @Test
    @DisplayName("Fitting counts the text that follows the group")
    void testFitsLooksPastGroup() {
        Doc doc = concat(group(text("aaa"), line(), text("b")), text("cccc"));
        assertEquals("aaa b", render(group(text("aaa"), line(), text("b")), 6));
        assertEquals("aaa\nbcccc", render(doc, 6));
    }

    @Test
    @DisplayName("Fitting stops at the next line break after the group")
    void testFitsStopsAtLineBreak() {
        Doc doc = concat(group(text("aaa"), line(), text("b")), hardline(), text("cccccccccc"));
        assertEquals("aaa b\ncccccccccc", render(doc, 6));
    }

    @Test
    @DisplayName("Outer groups break before inner ones")
    void testOuterFirst() {
        Doc doc = group(
            text("f("),
            indent(softline(), group(text("a"), line(), text("b"))),
            softline(),
            text(")"));
        assertEquals("f(a b)", render(doc, 6));
        assertEquals("f(\n  a b\n)", render(doc, 5));
    }

    @Test
    @DisplayName("Text containing a newline resets the column")
    void testMultilineText() {
        Doc doc = concat(text("aaaa\nb"), group(text("c"), line(), text("d")));
        assertEquals("aaaa\nbc d", render(doc, 4));
    }

    @Test
    @DisplayName("Trailing spaces are trimmed")
    void testTrailingSpaces() {
        assertEquals("a\nb", render(concat(text("a  "), hardline(), text("b")), 80));
        assertEquals("a", render(concat(text("a"), text(" ")), 80));
        assertEquals("{\n\n  x", render(concat(text("{"), indent(hardline(), hardline(), text("x"))), 80));
    }

    @Test
    @DisplayName("Join puts the separator between items only")
    void testJoin() {
        assertEquals("a, b, c", render(join(text(", "), text("a"), text("b"), text("c")), 80));
        assertEquals("", render(join(text(", ")), 80));
    }

    @Test
    @DisplayName("Options reject non-positive width")
    void testOptionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PrintOptions(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new PrintOptions(80, -1));
        assertEquals(new PrintOptions(100, 2), PrintOptions.DEFAULT.withPrintWidth(100));
    }
}
