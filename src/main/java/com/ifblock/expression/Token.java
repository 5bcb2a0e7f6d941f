package com.ifblock.expression;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Decoded literal value (string contents, boolean), null otherwise
 * @param position Offset in the expression text
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
