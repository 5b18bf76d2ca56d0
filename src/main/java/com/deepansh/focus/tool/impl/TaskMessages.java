package com.deepansh.focus.tool.impl;

import com.deepansh.focus.tool.ToolResult;

final class TaskMessages {

    private TaskMessages() {}

    static ToolResult notFound(String description) {
        return ToolResult.error("Could not find task: '" + description + "'");
    }

    /** Empty or blank clears the field. */
    static String clearable(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
