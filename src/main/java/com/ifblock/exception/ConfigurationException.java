package com.ifblock.exception;

/**
 * Exception thrown when engine options or variable sources are invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends IfBlockException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
