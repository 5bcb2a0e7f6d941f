package com.ifblock.expression;

import com.ifblock.exception.ExpressionException;
import com.ifblock.expression.node.Expression;

import java.util.List;

/**
 * Facade for parsing condition expressions into expression trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: &amp;&amp;, ||, !</li>
 *   <li>Equality: ==, !=</li>
 *   <li>Literals: 'single' or "double" quoted strings, numbers, true/false</li>
 *   <li>Variable paths: ROLE, USER.NAME</li>
 *   <li>Functions: contains, startsWith, endsWith, in, exists; also as methods (ROLE.Contains('X'))</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: ! > ==, != > &amp;&amp; > || (parentheses override)
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition expression into an expression tree.
     *
     * @param expression Expression string
     * @return Parsed expression
     * @throws ExpressionException LexError or ParseError, positioned within the expression
     */
    public static Expression parse(String expression) {
        String text = expression == null ? "" : expression;

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(text);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(text, tokens);
        return parser.parse();
    }
}
