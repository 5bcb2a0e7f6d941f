package com.ifblock.evaluation;

import com.ifblock.exception.UnknownVariableException;
import com.ifblock.expression.node.ArrayExpression;
import com.ifblock.expression.node.BinaryExpression;
import com.ifblock.expression.node.BinaryOperator;
import com.ifblock.expression.node.CallExpression;
import com.ifblock.expression.node.Expression;
import com.ifblock.expression.node.LiteralExpression;
import com.ifblock.expression.node.NotExpression;
import com.ifblock.expression.node.VariableExpression;
import com.ifblock.value.Value;
import com.ifblock.value.ValueType;
import com.ifblock.variable.VariableAccessor;

import java.util.List;
import java.util.Optional;

/**
 * Default implementation of ExpressionEvaluator.
 * <p>
 * Comparisons are type-aware: values of different kinds, or anything
 * involving Missing, never compare equal or unequal. Strings follow the
 * configured case mode, folded per character the same way for equality
 * and for every string function. Logical operators short-circuit left to right.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private final VariableAccessor accessor;
    private final EvaluationOptions options;

    public DefaultExpressionEvaluator(VariableAccessor accessor, EvaluationOptions options) {
        this.accessor = accessor;
        this.options = options;
    }

    @Override
    public Value evaluate(Expression expression, String source, int line) {
        return switch (expression.getType()) {
            case LITERAL -> ((LiteralExpression) expression).value();
            case VARIABLE -> resolve(((VariableExpression) expression).path(), source, line);
            case NOT -> Value.of(!evaluate(((NotExpression) expression).operand(), source, line).isTruthy());
            case BINARY -> evaluateBinary((BinaryExpression) expression, source, line);
            case CALL -> evaluateCall((CallExpression) expression, source, line);
            case ARRAY -> throw new IllegalStateException("Array literal outside in(): " + expression);
        };
    }

    private Value resolve(String path, String source, int line) {
        Optional<Value> value = accessor.tryGet(path);
        if (value.isPresent()) {
            return value.get();
        }
        if (options.strict()) {
            throw new UnknownVariableException(path, source, line);
        }
        return Value.MISSING;
    }

    private Value evaluateBinary(BinaryExpression binary, String source, int line) {
        return switch (binary.operator()) {
            case AND -> Value.of(evaluate(binary.left(), source, line).isTruthy()
                    && evaluate(binary.right(), source, line).isTruthy());
            case OR -> Value.of(evaluate(binary.left(), source, line).isTruthy()
                    || evaluate(binary.right(), source, line).isTruthy());
            case EQUALS, NOT_EQUALS -> {
                Value left = evaluate(binary.left(), source, line);
                Value right = evaluate(binary.right(), source, line);
                if (!comparable(left, right)) {
                    yield Value.FALSE;
                }
                boolean equal = valuesEqual(left, right);
                yield Value.of(binary.operator() == BinaryOperator.EQUALS ? equal : !equal);
            }
        };
    }

    private Value evaluateCall(CallExpression call, String source, int line) {
        List<Expression> args = call.arguments();
        return switch (call.function()) {
            case EXISTS -> Value.of(accessor.contains(((VariableExpression) args.get(0)).path()));
            case IN -> Value.of(in(evaluate(args.get(0), source, line), ((ArrayExpression) args.get(1)).elements()));
            case CONTAINS -> Value.of(contains(evaluate(args.get(0), source, line), evaluate(args.get(1), source, line)));
            case STARTS_WITH -> Value.of(startsWith(evaluate(args.get(0), source, line), evaluate(args.get(1), source, line)));
            case ENDS_WITH -> Value.of(endsWith(evaluate(args.get(0), source, line), evaluate(args.get(1), source, line)));
        };
    }

    private boolean in(Value value, List<Value> candidates) {
        for (Value candidate : candidates) {
            if (comparable(value, candidate) && valuesEqual(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private boolean contains(Value haystack, Value needle) {
        if (!bothStrings(haystack, needle)) {
            return false;
        }
        String s = haystack.asString();
        String p = needle.asString();
        for (int offset = 0; offset + p.length() <= s.length(); offset++) {
            if (s.regionMatches(!options.caseSensitiveStrings(), offset, p, 0, p.length())) {
                return true;
            }
        }
        return false;
    }

    private boolean startsWith(Value text, Value prefix) {
        if (!bothStrings(text, prefix)) {
            return false;
        }
        String s = text.asString();
        String p = prefix.asString();
        return s.regionMatches(!options.caseSensitiveStrings(), 0, p, 0, p.length());
    }

    private boolean endsWith(Value text, Value suffix) {
        if (!bothStrings(text, suffix)) {
            return false;
        }
        String s = text.asString();
        String p = suffix.asString();
        int offset = s.length() - p.length();
        return offset >= 0 && s.regionMatches(!options.caseSensitiveStrings(), offset, p, 0, p.length());
    }

    private static boolean comparable(Value left, Value right) {
        return left.getType() == right.getType() && !left.isMissing();
    }

    /**
     * Equality of two values of the same present kind.
     */
    private boolean valuesEqual(Value left, Value right) {
        return switch (left.getType()) {
            case STRING -> options.caseSensitiveStrings()
                    ? left.asString().equals(right.asString())
                    : left.asString().equalsIgnoreCase(right.asString());
            case NUMBER -> left.asNumber() == right.asNumber();
            case BOOLEAN -> left.asBoolean() == right.asBoolean();
            case MISSING -> false;
        };
    }

    private static boolean bothStrings(Value a, Value b) {
        return a.getType() == ValueType.STRING && b.getType() == ValueType.STRING;
    }
}
