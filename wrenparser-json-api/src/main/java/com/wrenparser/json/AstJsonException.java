package com.wrenparser.json;

/**
 * Thrown when a syntax tree cannot be written as JSON. The cause is the
 * provider's own exception.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
