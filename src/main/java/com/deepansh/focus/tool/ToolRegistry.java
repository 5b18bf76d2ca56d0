package com.deepansh.focus.tool;

import com.deepansh.focus.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring injects every AgentTool bean; they are indexed by name once, at startup.
 * Two tools with the same name abort startup.
 *
 * Execution failures are returned as tool errors so the conversation always
 * continues and the model can decide what to do next.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;

    public ToolRegistry(List<AgentTool> toolBeans) {
        Map<String, AgentTool> indexed = new LinkedHashMap<>();
        for (AgentTool tool : toolBeans) {
            AgentTool previous = indexed.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate tool name '%s' registered by %s and %s",
                        tool.getName(), previous.getClass().getName(), tool.getClass().getName()));
            }
            log.info("Registered tool: [{}]", tool.getName());
        }
        this.tools = Collections.unmodifiableMap(indexed);
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(ToolDefinition::from).toList();
    }

    /**
     * Definitions for a tier's tool subset, in registration order.
     * Names that are not registered are ignored here; the ladder is validated at startup.
     */
    public List<ToolDefinition> definitions(Collection<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        return tools.values().stream()
                .filter(tool -> names.contains(tool.getName()))
                .map(ToolDefinition::from)
                .toList();
    }

    /**
     * Dispatches a tool call. Never throws.
     */
    public ToolResult execute(ToolCall toolCall) {
        AgentTool tool = tools.get(toolCall.getToolName());

        if (tool == null) {
            log.warn("Model requested unknown tool [{}]", toolCall.getToolName());
            return ToolResult.error("unknown tool: " + toolCall.getToolName());
        }

        log.info("Executing tool: [{}] [callId={}]", toolCall.getToolName(), toolCall.getId());

        try {
            ToolResult result = tool.execute(toolCall.getArgumentsJson());
            if (result == null) {
                return ToolResult.error(toolCall.getToolName() + " returned no result");
            }
            log.debug("Tool [{}] returned success={}: {}", toolCall.getToolName(), result.isSuccess(), result.getText());
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool [{}]", toolCall.getToolName(), e);
            return ToolResult.error(toolCall.getToolName() + " failed: " + e.getClass().getSimpleName());
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    public int toolCount() {
        return tools.size();
    }
}
