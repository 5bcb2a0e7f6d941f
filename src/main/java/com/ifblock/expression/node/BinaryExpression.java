package com.ifblock.expression.node;

/**
 * Equality or logical operator applied to two operands.
 */
public record BinaryExpression(BinaryOperator operator, Expression left, Expression right)
        implements Expression {

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
