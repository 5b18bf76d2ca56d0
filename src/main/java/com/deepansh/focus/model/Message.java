package com.deepansh.focus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One entry of a conversation log. Immutable once built.
 *
 * An assistant message either carries text or a non-empty list of tool calls
 * (content may then be null). A tool message answers exactly one of those calls
 * through {@code toolCallId}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Message {

    public enum Role { system, user, assistant, tool }

    Role role;
    String content;

    /** Set on tool messages only. */
    String toolCallId;

    /** Tool name, set on tool messages only. */
    String name;

    /** Set on assistant messages that request tools. */
    List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message assistantToolCalls(List<ToolCall> toolCalls) {
        return Message.builder().role(Role.assistant).toolCalls(List.copyOf(toolCalls)).build();
    }

    public static Message tool(String toolCallId, String name, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(toolCallId)
                .name(name)
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean carriesToolCalls() {
        return role == Role.assistant && toolCalls != null && !toolCalls.isEmpty();
    }

    /** True when this assistant message requested a call with the given id. */
    public boolean requested(String callId) {
        if (!carriesToolCalls() || callId == null) {
            return false;
        }
        return toolCalls.stream().anyMatch(tc -> callId.equals(tc.getId()));
    }
}
