package com.deepansh.focus.backend;

import com.deepansh.focus.model.ErrorKind;
import lombok.Getter;

/**
 * Thrown inside an adapter once a failure has already been classified,
 * e.g. from an HTTP status handler or the response parser.
 */
@Getter
public class BackendCallException extends RuntimeException {

    private final ErrorKind kind;

    public BackendCallException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendCallException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
