package com.ifblock.expression.node;

import com.ifblock.value.Value;

/**
 * A string, number or boolean literal.
 */
public record LiteralExpression(Value value) implements Expression {

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
