package com.jsast.json;

/**
 * Thrown when a plain tree cannot be written as JSON, typically wrapping the
 * underlying library's exception.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
