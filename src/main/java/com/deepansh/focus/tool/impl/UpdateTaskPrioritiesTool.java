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

@Component
public class UpdateTaskPrioritiesTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public UpdateTaskPrioritiesTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "updateTaskPriorities";
    }

    @Override
    public String getDescription() {
        return "Updates the priority order of tasks in the to-do list.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "orderedTaskDescriptions", Map.of(
                        "type", "array",
                        "items", Map.of("type", "string"),
                        "description", "An array of task description strings, ordered from highest priority (index 0) to lowest.")
        ), "orderedTaskDescriptions");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        List<String> ordered = args.requireStringList("orderedTaskDescriptions");
        try {
            taskStore.reorder(ordered);
        } catch (TaskNotFoundException e) {
            return ToolResult.error(e.getMessage() + ". Priorities were not changed.");
        }
        return ToolResult.ok("Task priorities updated successfully.");
    }
}
