package com.vaceline;

import com.vaceline.ast.Comment;
import com.vaceline.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans VCL source into tokens. Comments are collected on the side rather than emitted as tokens.
 */
public class Lexer {

    private final String source;
    private final char[] buf;
    private final int length;
    private final List<Comment> comments = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int column = 1;

    // Start of the token being scanned
    private int tokenPos;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String source) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    /**
     * Scans the whole source. The returned list always ends with one {@link TokenType#EOF} token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            markStart();
            if (pos >= length) {
                tokens.add(finish(TokenType.EOF));
                return tokens;
            }
            tokens.add(scanToken());
        }
    }

    /**
     * Comments seen by {@link #tokenize()}, in source order.
     */
    public List<Comment> comments() {
        return comments;
    }

    private Token scanToken() {
        char c = buf[pos];

        if (isIdentifierStart(c)) {
            return scanIdentifier();
        }
        if (isDigit(c)) {
            return scanNumber();
        }
        if (c == '"') {
            return scanString();
        }
        if (c == '{' && peekChar(1) == '"') {
            return scanLongString();
        }

        advance();
        return switch (c) {
            case '(' -> finish(TokenType.LPAREN);
            case ')' -> finish(TokenType.RPAREN);
            case '{' -> finish(TokenType.LBRACE);
            case '}' -> finish(TokenType.RBRACE);
            case ';' -> finish(TokenType.SEMICOLON);
            case ',' -> finish(TokenType.COMMA);
            case '.' -> finish(TokenType.DOT);
            case ':' -> finish(TokenType.COLON);
            case '~' -> finish(TokenType.MATCH);
            case '/' -> matchChar('=') ? finish(TokenType.COMPOUND_ASSIGN) : finish(TokenType.SLASH);
            case '+' -> matchChar('=') ? finish(TokenType.COMPOUND_ASSIGN) : finish(TokenType.PLUS);
            case '-' -> matchChar('=') ? finish(TokenType.COMPOUND_ASSIGN) : finish(TokenType.MINUS);
            case '*', '%', '^' -> {
                if (matchChar('=')) yield finish(TokenType.COMPOUND_ASSIGN);
                throw unexpected(c);
            }
            case '!' -> {
                if (matchChar('=')) yield finish(TokenType.NE);
                if (matchChar('~')) yield finish(TokenType.NOT_MATCH);
                yield finish(TokenType.BANG);
            }
            case '=' -> matchChar('=') ? finish(TokenType.EQ) : finish(TokenType.ASSIGN);
            case '<' -> {
                if (peekChar(0) == '<' && peekChar(1) == '=') {
                    advance();
                    advance();
                    yield finish(TokenType.COMPOUND_ASSIGN);
                }
                yield matchChar('=') ? finish(TokenType.LE) : finish(TokenType.LT);
            }
            case '>' -> {
                if (peekChar(0) == '>' && peekChar(1) == '=') {
                    advance();
                    advance();
                    yield finish(TokenType.COMPOUND_ASSIGN);
                }
                yield matchChar('=') ? finish(TokenType.GE) : finish(TokenType.GT);
            }
            case '&' -> {
                if (matchChar('&')) {
                    yield matchChar('=') ? finish(TokenType.COMPOUND_ASSIGN) : finish(TokenType.AND);
                }
                if (matchChar('=')) yield finish(TokenType.COMPOUND_ASSIGN);
                throw unexpected(c);
            }
            case '|' -> {
                if (matchChar('|')) {
                    yield matchChar('=') ? finish(TokenType.COMPOUND_ASSIGN) : finish(TokenType.OR);
                }
                if (matchChar('=')) yield finish(TokenType.COMPOUND_ASSIGN);
                throw unexpected(c);
            }
            default -> throw unexpected(c);
        };
    }

    private Token scanIdentifier() {
        while (pos < length && isIdentifierPart(buf[pos])) {
            // x-= is a compound assignment, not part of the name
            if (buf[pos] == '-' && peekChar(1) == '=') {
                break;
            }
            advance();
        }
        String word = source.substring(tokenPos, pos);
        // rol= and ror= are the only word-shaped operators
        if ((word.equals("rol") || word.equals("ror")) && peekChar(0) == '=' && peekChar(1) != '=') {
            advance();
            return finish(TokenType.COMPOUND_ASSIGN);
        }
        return finish(TokenType.IDENTIFIER);
    }

    private Token scanNumber() {
        while (pos < length && isDigit(buf[pos])) {
            advance();
        }
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            advance();
            while (pos < length && isDigit(buf[pos])) {
                advance();
            }
        }
        // Unit suffix (35s, 100ms); validated by the parser
        while (pos < length && isLetter(buf[pos])) {
            advance();
        }
        return finish(TokenType.NUMBER);
    }

    private Token scanString() {
        advance(); // opening quote
        while (true) {
            if (pos >= length || buf[pos] == '\n') {
                throw new ParseException("Unterminated string literal", currentSpan());
            }
            if (advance() == '"') {
                return finish(TokenType.STRING);
            }
        }
    }

    private Token scanLongString() {
        advance(); // {
        advance(); // "
        while (pos < length) {
            if (buf[pos] == '"' && peekChar(1) == '}') {
                advance();
                advance();
                return finish(TokenType.LONG_STRING);
            }
            advance();
        }
        throw new ParseException("Unterminated long string literal", currentSpan());
    }

    private void skipWhitespaceAndComments() {
        while (pos < length) {
            char c = buf[pos];
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                advance();
            } else if (c == '#' || (c == '/' && peekChar(1) == '/')) {
                markStart();
                while (pos < length && buf[pos] != '\n' && buf[pos] != '\r') {
                    advance();
                }
                addComment();
            } else if (c == '/' && peekChar(1) == '*') {
                markStart();
                advance();
                advance();
                while (!(peekChar(0) == '*' && peekChar(1) == '/')) {
                    if (pos >= length) {
                        throw new ParseException("Unterminated block comment", currentSpan());
                    }
                    advance();
                }
                advance();
                advance();
                addComment();
            } else {
                return;
            }
        }
    }

    private void addComment() {
        comments.add(new Comment(currentSpan(), source.substring(tokenPos, pos)));
    }

    private void markStart() {
        tokenPos = pos;
        tokenLine = line;
        tokenColumn = column;
    }

    private Token finish(TokenType type) {
        return new Token(type, source.substring(tokenPos, pos), tokenPos, pos, tokenLine, tokenColumn, line, column);
    }

    private SourceLocation currentSpan() {
        return new SourceLocation(
            new SourceLocation.Position(tokenPos, tokenLine, tokenColumn),
            new SourceLocation.Position(pos, line, column)
        );
    }

    private ParseException unexpected(char c) {
        return new ParseException("Unexpected character '" + c + "'", currentSpan());
    }

    private char advance() {
        char c = buf[pos++];
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean matchChar(char expected) {
        if (pos < length && buf[pos] == expected) {
            advance();
            return true;
        }
        return false;
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < length ? buf[index] : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        // Header names such as X-Forwarded-For are single identifiers
        return isLetter(c) || isDigit(c) || c == '_' || c == '-';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
