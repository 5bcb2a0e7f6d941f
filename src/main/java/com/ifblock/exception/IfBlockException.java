package com.ifblock.exception;

/**
 * Base exception for the ifblock engine.
 */
public class IfBlockException extends RuntimeException {

    public IfBlockException(String message) {
        super(message);
    }

    public IfBlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
