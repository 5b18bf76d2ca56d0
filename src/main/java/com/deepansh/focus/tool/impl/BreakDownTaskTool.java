package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskNotFoundException;
import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Splits an overwhelming task into small steps placed where the original sat.
 * The original is replaced unless replaceOriginal is false.
 */
@Component
public class BreakDownTaskTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public BreakDownTaskTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "breakDownTask";
    }

    @Override
    public String getDescription() {
        return """
                Breaks down a large, complex task into smaller, more manageable subtasks.
                Essential for ADHD users who struggle with overwhelming tasks.
                Each subtask should be actionable and completable in 15-30 minutes.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "originalTaskDescription", stringProperty("The description of the large task to break down."),
                "subtasks", Map.of(
                        "type", "array",
                        "items", Map.of("type", "string"),
                        "description", "Array of smaller, actionable subtasks. Each subtask should be specific, measurable, and completable in 15-30 minutes."),
                "replaceOriginal", Map.of(
                        "type", "boolean",
                        "description", "Whether to replace the original task with the subtasks (true) or keep both (false). Default is true.")
        ), "originalTaskDescription", "subtasks");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String original = args.requireString("originalTaskDescription");
        List<String> subtasks = args.requireStringList("subtasks");
        boolean replace = args.optionalBoolean("replaceOriginal", true);

        try {
            taskStore.breakDown(original, subtasks, replace);
        } catch (TaskNotFoundException e) {
            return ToolResult.error("Could not find the original task: '" + original + "'");
        }

        String action = replace ? "replaced with" : "broken down into";
        return ToolResult.ok("Task '" + original + "' " + action + " " + subtasks.size() + " subtasks:\n\n"
                + subtasks.stream().map(s -> "• " + s).collect(Collectors.joining("\n")));
    }
}
