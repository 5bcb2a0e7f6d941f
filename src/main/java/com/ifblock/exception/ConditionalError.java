package com.ifblock.exception;

import java.util.Objects;

/**
 * Structured description of a template evaluation failure.
 *
 * @param kind       Failure kind
 * @param message    Human-readable description
 * @param line       1-based source line, or 0 when not yet known
 * @param expression Offending expression text (may be null)
 * @param variable   Offending variable path (may be null)
 */
public record ConditionalError(
        ErrorKind kind,
        String message,
        int line,
        String expression,
        String variable
) {

    public ConditionalError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ConditionalError of(ErrorKind kind, String message, int line) {
        return new ConditionalError(kind, message, line, null, null);
    }

    /**
     * Copy of this error positioned at the given line.
     */
    public ConditionalError atLine(int newLine) {
        return new ConditionalError(kind, message, newLine, expression, variable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.getLabel());
        if (line > 0) {
            sb.append(" at line ").append(line);
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
