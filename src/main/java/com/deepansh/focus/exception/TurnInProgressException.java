package com.deepansh.focus.exception;

public class TurnInProgressException extends FocusException {

    public TurnInProgressException(String sessionId) {
        super("A message is already being processed for session " + sessionId);
    }
}
