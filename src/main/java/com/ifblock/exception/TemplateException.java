package com.ifblock.exception;

/**
 * Base exception for failures caused by the template input itself.
 * Carries the structured {@link ConditionalError} reported to callers.
 */
public class TemplateException extends IfBlockException {

    private final ConditionalError error;

    public TemplateException(ConditionalError error) {
        super(error.toString());
        this.error = error;
    }

    public ConditionalError getError() {
        return error;
    }
}
