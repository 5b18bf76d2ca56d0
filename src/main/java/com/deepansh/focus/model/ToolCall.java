package com.deepansh.focus.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A model-issued request to run a named tool.
 * Arguments stay as the raw JSON text the model produced; each tool decodes its own.
 */
@Value
@Builder
@Jacksonized
public class ToolCall {
    String id;
    String toolName;
    String argumentsJson;
}
