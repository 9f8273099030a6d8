package com.vaceline.printer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for {@link Doc} values.
 */
public final class Docs {

    public static final Doc EMPTY = new Doc.Text("");

    private static final Doc LINE = new Doc.Line();
    private static final Doc SOFTLINE = new Doc.Softline();
    private static final Doc HARDLINE = new Doc.Hardline();

    private Docs() {
        // Utility class
    }

    public static Doc text(String text) {
        return new Doc.Text(text);
    }

    public static Doc concat(Doc... parts) {
        return new Doc.Concat(List.of(parts));
    }

    public static Doc concat(List<Doc> parts) {
        return new Doc.Concat(List.copyOf(parts));
    }

    public static Doc group(Doc contents) {
        return new Doc.Group(contents, containsHardline(contents));
    }

    public static Doc group(Doc... parts) {
        return group(concat(parts));
    }

    public static Doc indent(Doc contents) {
        return new Doc.Indent(contents);
    }

    public static Doc indent(Doc... parts) {
        return indent(concat(parts));
    }

    public static Doc line() {
        return LINE;
    }

    public static Doc softline() {
        return SOFTLINE;
    }

    public static Doc hardline() {
        return HARDLINE;
    }

    public static Doc ifBreak(Doc breakContents, Doc flatContents) {
        return new Doc.IfBreak(breakContents, flatContents);
    }

    public static Doc join(Doc separator, List<Doc> docs) {
        List<Doc> parts = new ArrayList<>(docs.size() * 2);
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(docs.get(i));
        }
        return concat(parts);
    }

    public static Doc join(Doc separator, Doc... docs) {
        return join(separator, Arrays.asList(docs));
    }

    // A hard line anywhere inside a group forces it to break. Nested groups already know;
    // if-break branches do not count since only one of them is ever printed.
    private static boolean containsHardline(Doc doc) {
        if (doc instanceof Doc.Hardline) {
            return true;
        }
        if (doc instanceof Doc.Group group) {
            return group.shouldBreak();
        }
        if (doc instanceof Doc.Indent indent) {
            return containsHardline(indent.contents());
        }
        if (doc instanceof Doc.Concat concat) {
            for (Doc part : concat.parts()) {
                if (containsHardline(part)) {
                    return true;
                }
            }
        }
        return false;
    }
}
