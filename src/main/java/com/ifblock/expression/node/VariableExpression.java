package com.ifblock.expression.node;

/**
 * Reference to a variable by dot-path, e.g. {@code USER.ROLE}.
 */
public record VariableExpression(String path) implements Expression {

    @Override
    public ExpressionType getType() {
        return ExpressionType.VARIABLE;
    }

    @Override
    public String toString() {
        return path;
    }
}
