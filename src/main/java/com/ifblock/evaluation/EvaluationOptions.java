package com.ifblock.evaluation;

import com.ifblock.exception.ConfigurationException;

/**
 * Options controlling conditional evaluation.
 *
 * @param strict               Unknown variables raise UnknownVariableStrict instead of evaluating as Missing
 * @param caseSensitiveStrings String equality and string functions compare case-sensitively
 * @param maxNesting           Maximum depth of nested blocks
 */
public record EvaluationOptions(boolean strict, boolean caseSensitiveStrings, int maxNesting) {

    public static final int DEFAULT_MAX_NESTING = 10;

    private static final EvaluationOptions DEFAULTS = new EvaluationOptions(false, false, DEFAULT_MAX_NESTING);

    public EvaluationOptions {
        if (maxNesting < 1) {
            throw new ConfigurationException("maxNesting must be at least 1, got " + maxNesting);
        }
    }

    /**
     * Lenient, case-insensitive, nesting up to {@value #DEFAULT_MAX_NESTING}.
     */
    public static EvaluationOptions defaults() {
        return DEFAULTS;
    }

    public EvaluationOptions withStrict(boolean value) {
        return new EvaluationOptions(value, caseSensitiveStrings, maxNesting);
    }

    public EvaluationOptions withCaseSensitiveStrings(boolean value) {
        return new EvaluationOptions(strict, value, maxNesting);
    }

    public EvaluationOptions withMaxNesting(int value) {
        return new EvaluationOptions(strict, caseSensitiveStrings, value);
    }
}
