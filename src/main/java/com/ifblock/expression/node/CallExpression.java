package com.ifblock.expression.node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a built-in function. Method-style calls ({@code X.Contains(Y)})
 * produce the same node with the receiver as first argument.
 */
public record CallExpression(BuiltinFunction function, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CALL;
    }

    @Override
    public String toString() {
        return function.getName() + arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
