package com.ifblock.evaluation;

import com.ifblock.expression.node.Expression;
import com.ifblock.value.Value;

/**
 * Evaluates expression trees against a variable store.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluate an expression to a value.
     *
     * @param expression Parsed expression
     * @param source     Expression text, reported in errors
     * @param line       Template line of the expression, reported in errors
     * @return Resulting value
     */
    Value evaluate(Expression expression, String source, int line);

    /**
     * Evaluate an expression as a branch condition.
     *
     * @return true if the result is truthy
     */
    default boolean test(Expression expression, String source, int line) {
        return evaluate(expression, source, line).isTruthy();
    }
}
