package com.ifblock.expression.node;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in functions callable from condition expressions.
 */
public enum BuiltinFunction {
    CONTAINS("contains", 2),
    STARTS_WITH("startsWith", 2),
    ENDS_WITH("endsWith", 2),
    IN("in", 2),
    EXISTS("exists", 1);

    private final String name;
    private final int arity;

    BuiltinFunction(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Look up a function by name, ignoring case.
     */
    public static Optional<BuiltinFunction> fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.name.equalsIgnoreCase(name))
                .findFirst();
    }
}
