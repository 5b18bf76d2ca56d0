package com.deepansh.focus.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of one backend send: final text, a batch of tool calls, or a classified failure.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BackendOutcome {

    public enum Type { TEXT, TOOL_CALLS, FAILURE }

    Type type;
    String content;
    List<ToolCall> toolCalls;
    ErrorKind failureKind;
    String detail;
    int promptTokens;
    int completionTokens;

    public static BackendOutcome text(String content) {
        return text(content, 0, 0);
    }

    public static BackendOutcome text(String content, int promptTokens, int completionTokens) {
        return new BackendOutcome(Type.TEXT, content, List.of(), null, null, promptTokens, completionTokens);
    }

    public static BackendOutcome toolCalls(List<ToolCall> calls) {
        return toolCalls(calls, 0, 0);
    }

    public static BackendOutcome toolCalls(List<ToolCall> calls, int promptTokens, int completionTokens) {
        if (calls == null || calls.isEmpty()) {
            throw new IllegalArgumentException("A tool-call outcome needs at least one call");
        }
        return new BackendOutcome(Type.TOOL_CALLS, null, List.copyOf(calls), null, null,
                promptTokens, completionTokens);
    }

    public static BackendOutcome failure(ErrorKind kind, String detail) {
        return new BackendOutcome(Type.FAILURE, null, List.of(), kind, detail, 0, 0);
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    public boolean isToolCalls() {
        return type == Type.TOOL_CALLS;
    }
}
