package com.deepansh.focus.tool;

import java.util.Map;

/**
 * Contract for every tool the assistant can call.
 *
 * Implementations must be Spring @Components so they are auto-discovered by
 * ToolRegistry. Tools must NEVER throw: decode errors, domain errors and
 * collaborator failures all come back as {@link ToolResult#error(String)}.
 * Side effects are finished before {@link #execute(String)} returns.
 */
public interface AgentTool {

    /** Unique name the model uses to call this tool, e.g. "addTaskToList". */
    String getName();

    /** Natural-language description shown to the model. */
    String getDescription();

    /**
     * JSON Schema for the arguments object, e.g.
     * { "type": "object", "properties": { "taskDescription": { "type": "string" } }, "required": [...] }
     */
    Map<String, Object> getInputSchema();

    /**
     * Run the tool with the raw arguments text from the model.
     */
    ToolResult execute(String argumentsJson);
}
