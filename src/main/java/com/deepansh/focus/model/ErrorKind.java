package com.deepansh.focus.model;

/**
 * Shared failure taxonomy. Backend adapters map their transport and protocol
 * errors onto these; nothing backend-specific travels above the adapter.
 */
public enum ErrorKind {

    BACKEND_UNAVAILABLE("The assistant service is unreachable right now."),
    TIMEOUT("The assistant took too long to answer."),
    CONTENT_FILTERED("The assistant declined to answer that request."),
    MALFORMED_RESPONSE("The assistant sent a reply that could not be understood."),
    TOOL_EXECUTION_FAILED("An action could not be completed."),
    RECURSION_LIMIT_EXCEEDED("The assistant got stuck repeating actions, so the request was stopped."),
    ALL_TIERS_EXHAUSTED("No assistant backend could handle the request. Please try again in a moment."),
    CANCELLED("The request was cancelled.");

    private final String userMessage;

    ErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }

    /** Kinds that move the turn to the next capability tier. */
    public boolean degrades() {
        return this == BACKEND_UNAVAILABLE
                || this == TIMEOUT
                || this == CONTENT_FILTERED
                || this == MALFORMED_RESPONSE;
    }
}
