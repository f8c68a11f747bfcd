package com.encsyntax.json;

/**
 * Exception thrown when syntax tree JSON serialization or deserialization fails.
 */
public class SyntaxJsonException extends RuntimeException {

    public SyntaxJsonException(String message) {
        super(message);
    }

    public SyntaxJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public SyntaxJsonException(Throwable cause) {
        super(cause);
    }
}
