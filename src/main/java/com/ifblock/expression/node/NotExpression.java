package com.ifblock.expression.node;

/**
 * Logical negation of the operand's truthiness.
 */
public record NotExpression(Expression operand) implements Expression {

    @Override
    public ExpressionType getType() {
        return ExpressionType.NOT;
    }

    @Override
    public String toString() {
        return "!" + operand;
    }
}
