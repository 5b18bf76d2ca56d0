package com.deepansh.focus.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to a backend.
 * Each backend adapter renders it in its own wire format.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(Map.copyOf(tool.getInputSchema()))
                .build();
    }

    /**
     * Function-calling shape shared by OpenAI-compatible and Ollama chat APIs:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toFunctionSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
