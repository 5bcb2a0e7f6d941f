package com.ifblock.value;

import java.util.Objects;

/**
 * Immutable expression value: a String, a Number, a Boolean, or Missing.
 * Numbers are held at double precision so integer and fractional forms
 * of the same quantity compare equal.
 */
public final class Value {

    public static final Value MISSING = new Value(ValueType.MISSING, null);
    public static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    private final Object raw;

    private Value(ValueType type, Object raw) {
        this.type = type;
        this.raw = raw;
    }

    public static Value of(String text) {
        return new Value(ValueType.STRING, Objects.requireNonNull(text, "text"));
    }

    public static Value of(double number) {
        return new Value(ValueType.NUMBER, number);
    }

    public static Value of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isMissing() {
        return type == ValueType.MISSING;
    }

    public String asString() {
        requireType(ValueType.STRING);
        return (String) raw;
    }

    public double asNumber() {
        requireType(ValueType.NUMBER);
        return (Double) raw;
    }

    public boolean asBoolean() {
        requireType(ValueType.BOOLEAN);
        return (Boolean) raw;
    }

    /**
     * Condition truthiness: a Boolean is itself, Missing is false,
     * any other present value is true.
     */
    public boolean isTruthy() {
        return switch (type) {
            case BOOLEAN -> (Boolean) raw;
            case MISSING -> false;
            case STRING, NUMBER -> true;
        };
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        if (type != other.type) {
            return false;
        }
        if (type == ValueType.NUMBER) {
            // 0.0 and -0.0 are the same number
            return asNumber() == other.asNumber();
        }
        return Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        if (type == ValueType.NUMBER) {
            double d = asNumber();
            return Objects.hash(type, d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, raw);
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "'" + raw + "'";
            case NUMBER -> {
                double d = (Double) raw;
                yield d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d) : String.valueOf(d);
            }
            case BOOLEAN -> String.valueOf(raw);
            case MISSING -> "<missing>";
        };
    }
}
