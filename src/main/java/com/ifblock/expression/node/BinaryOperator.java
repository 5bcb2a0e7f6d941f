package com.ifblock.expression.node;

/**
 * Binary operators, in the order the parser climbs them (tightest first).
 */
public enum BinaryOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    AND("&&"),
    OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
