package com.ifblock.expression;

/**
 * Token types for condition expressions.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,

    // Logical operators
    AND,
    OR,
    NOT,

    // Equality operators
    EQ,
    NE,

    // Special
    EOF
}
