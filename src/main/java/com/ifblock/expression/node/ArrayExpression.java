package com.ifblock.expression.node;

import com.ifblock.value.Value;

import java.util.List;

/**
 * Array literal; only legal as the candidate list of {@code in(value, [...])}.
 */
public record ArrayExpression(List<Value> elements) implements Expression {

    public ArrayExpression {
        elements = List.copyOf(elements);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ARRAY;
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
