package com.github.linkyeeter.exception;

/**
 * Base exception for all application errors.
 */
public class LinkYeeterException extends RuntimeException {

    public LinkYeeterException(String message) {
        super(message);
    }

    public LinkYeeterException(String message, Throwable cause) {
        super(message, cause);
    }

    public LinkYeeterException(Throwable cause) {
        super(cause);
    }
}
