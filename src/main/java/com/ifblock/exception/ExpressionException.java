package com.ifblock.exception;

/**
 * Lexing or parsing failure inside a condition expression.
 * The position is an offset within the expression text; the line is
 * filled in by the caller that knows where the expression sits in the template.
 */
public class ExpressionException extends TemplateException {

    private final int position;

    public ExpressionException(ConditionalError error, int position) {
        super(error);
        this.position = position;
    }

    public static ExpressionException lex(String message, int position, String input) {
        return new ExpressionException(new ConditionalError(ErrorKind.LEX_ERROR,
                message + " at position " + position, 0, input, null), position);
    }

    public static ExpressionException parse(String message, int position, String input) {
        return new ExpressionException(new ConditionalError(ErrorKind.PARSE_ERROR,
                message + " at position " + position, 0, input, null), position);
    }

    public int getPosition() {
        return position;
    }

    /**
     * Same failure, positioned at an absolute template line.
     */
    public ExpressionException atLine(int line) {
        return new ExpressionException(getError().atLine(line), position);
    }
}
