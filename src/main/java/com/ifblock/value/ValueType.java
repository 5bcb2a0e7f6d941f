package com.ifblock.value;

/**
 * Kinds of values an expression can produce.
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    MISSING
}
