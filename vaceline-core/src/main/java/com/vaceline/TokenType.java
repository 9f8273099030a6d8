package com.vaceline;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    NUMBER,
    STRING,
    LONG_STRING,

    // Punctuators
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    SEMICOLON,
    COMMA,
    DOT,
    COLON,
    SLASH,

    // Operators
    PLUS,
    MINUS,
    BANG,
    EQ,
    NE,
    MATCH,
    NOT_MATCH,
    LT,
    GT,
    LE,
    GE,
    AND,
    OR,

    // Assignment
    ASSIGN,
    COMPOUND_ASSIGN,

    EOF
}
