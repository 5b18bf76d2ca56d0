package com.deepansh.focus.exception;

/**
 * Base unchecked exception for domain errors that reach the API layer.
 */
public class FocusException extends RuntimeException {

    public FocusException(String message) {
        super(message);
    }

    public FocusException(String message, Throwable cause) {
        super(message, cause);
    }
}
