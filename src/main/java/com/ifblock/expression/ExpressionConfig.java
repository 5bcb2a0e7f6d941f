package com.ifblock.expression;

import java.util.Map;

/**
 * Configuration for expression keywords and operators.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords (upper-cased) mapped to token types.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    /**
     * Path separator for variable references and method-style calls.
     */
    public static final String PATH_SEPARATOR = ".";

    /**
     * Maximum nesting of parentheses, '!' and calls within one expression.
     */
    public static final int MAX_EXPRESSION_DEPTH = 64;

    /**
     * Maximum number of binary operators within one expression.
     */
    public static final int MAX_OPERATORS = 256;
}
