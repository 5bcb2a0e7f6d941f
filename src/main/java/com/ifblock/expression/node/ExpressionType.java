package com.ifblock.expression.node;

/**
 * Kinds of expression tree nodes.
 */
public enum ExpressionType {
    LITERAL,
    VARIABLE,
    NOT,
    BINARY,
    CALL,
    ARRAY
}
