package com.ifblock.exception;

/**
 * Block structure violation: orphaned tags, branches after else,
 * unterminated blocks, or nesting beyond the configured ceiling.
 */
public class StructureException extends TemplateException {

    public StructureException(ConditionalError error) {
        super(error);
    }

    public static StructureException structural(String message, int line) {
        return new StructureException(ConditionalError.of(ErrorKind.STRUCTURAL_ERROR, message, line));
    }

    public static StructureException depthExceeded(int maxNesting, int line) {
        return new StructureException(ConditionalError.of(ErrorKind.RECURSION_DEPTH_EXCEEDED,
                "Maximum nesting depth exceeded (" + maxNesting + ")", line));
    }
}
