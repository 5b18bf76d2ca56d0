package com.deepansh.focus.core;

/**
 * States of one user turn. A turn alternates between the first two until it ends
 * in one of the terminal states.
 */
public enum TurnState {
    AWAITING_SEND,
    EXECUTING_TOOLS,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
