package com.syntaxforge.json;

/**
 * Exception thrown when an AST or parse result cannot be written as JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
