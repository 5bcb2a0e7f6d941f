package com.ifblock.expression.node;

/**
 * Node of a parsed condition expression. Trees are immutable.
 */
public interface Expression {

    /**
     * Get the node type.
     */
    ExpressionType getType();
}
