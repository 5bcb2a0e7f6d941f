package com.ifblock.exception;

/**
 * Closed set of failure kinds a template evaluation can report.
 */
public enum ErrorKind {
    LEX_ERROR("LexError"),
    PARSE_ERROR("ParseError"),
    STRUCTURAL_ERROR("StructuralError"),
    RECURSION_DEPTH_EXCEEDED("RecursionDepthExceeded"),
    UNKNOWN_VARIABLE_STRICT("UnknownVariableStrict");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /**
     * Name used in JSON output and diagnostics.
     */
    public String getLabel() {
        return label;
    }
}
