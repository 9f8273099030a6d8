package com.vaceline;

import com.vaceline.ast.SourceLocation;

/**
 * The single error kind raised while lexing or parsing. Parsing stops at the first one.
 */
public class ParseException extends RuntimeException {

    private final String reason;
    private final SourceLocation location;

    public ParseException(String reason, SourceLocation location) {
        super(format(reason, location));
        this.reason = reason;
        this.location = location;
    }

    public ParseException(String reason, Token token) {
        this(reason, token.location());
    }

    /**
     * The message without the position suffix.
     */
    public String getReason() {
        return reason;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.start().line();
    }

    public int getColumn() {
        return location.start().column();
    }

    private static String format(String reason, SourceLocation location) {
        if (location == null) {
            return reason;
        }
        return reason + " (" + location.start().line() + ":" + location.start().column() + ")";
    }
}
