package com.vaceline;

import com.vaceline.ast.SourceLocation;

/**
 * Lexed token. Positions are 0-based offsets into the source; lines and columns are 1-based.
 */
public record Token(
    TokenType type,
    String lexeme,
    int position,
    int endPosition,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public SourceLocation location() {
        return new SourceLocation(
            new SourceLocation.Position(position, line, column),
            new SourceLocation.Position(endPosition, endLine, endColumn)
        );
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + lexeme + "'";
    }
}
