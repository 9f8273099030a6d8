package com.vaceline.printer;

/**
 * Layout settings for {@link Printer}.
 *
 * @param printWidth the column budget groups try to stay within
 * @param indentWidth spaces per indentation level
 */
public record PrintOptions(int printWidth, int indentWidth) {

    public static final PrintOptions DEFAULT = new PrintOptions(80, 2);

    public PrintOptions {
        if (printWidth <= 0) {
            throw new IllegalArgumentException("printWidth must be positive: " + printWidth);
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
    }

    public PrintOptions withPrintWidth(int printWidth) {
        return new PrintOptions(printWidth, indentWidth);
    }

    public PrintOptions withIndentWidth(int indentWidth) {
        return new PrintOptions(printWidth, indentWidth);
    }
}
