package com.ifblock.exception;

/**
 * Thrown in strict mode when an expression references a variable
 * the accessor cannot resolve.
 */
public class UnknownVariableException extends TemplateException {

    public UnknownVariableException(String path, String expression, int line) {
        super(new ConditionalError(ErrorKind.UNKNOWN_VARIABLE_STRICT,
                "Unknown variable: " + path, line, expression, path));
    }
}
