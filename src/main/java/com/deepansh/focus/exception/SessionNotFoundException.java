package com.deepansh.focus.exception;

public class SessionNotFoundException extends FocusException {

    public SessionNotFoundException(String sessionId) {
        super("Unknown session: " + sessionId);
    }
}
