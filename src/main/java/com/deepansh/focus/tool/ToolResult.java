package com.deepansh.focus.tool;

import lombok.Value;

/**
 * Outcome of one tool execution. The text becomes the tool message content
 * whether the call succeeded or not, so it is never empty.
 */
@Value
public class ToolResult {

    boolean success;
    String text;

    public static ToolResult ok(String text) {
        return new ToolResult(true, text == null || text.isBlank() ? "Done." : text);
    }

    public static ToolResult error(String text) {
        return new ToolResult(false, text == null || text.isBlank() ? "tool failed" : text);
    }
}
