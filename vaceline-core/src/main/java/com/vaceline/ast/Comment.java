package com.vaceline.ast;

/**
 * A source comment, kept verbatim including its {@code #}, {@code //} or {@code /*} marker.
 */
public record Comment(SourceLocation loc, String text) {

    public Comment(String text) {
        this(null, text);
    }
}
