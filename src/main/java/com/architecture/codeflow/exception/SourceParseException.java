package com.architecture.codeflow.exception;

/**
 * Thrown when Spoon cannot build a model from the submitted source text.
 */
public class SourceParseException extends RuntimeException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
