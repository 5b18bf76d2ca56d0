package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Ticks a task off. The task stays on the list.
 */
@Component
public class MarkTaskCompleteTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public MarkTaskCompleteTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "markTaskComplete";
    }

    @Override
    public String getDescription() {
        return "Marks a specific task as complete on the user's to-do list based on its description. Does NOT remove the task.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The exact description of the task to mark as complete.")
        ), "taskDescription");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        if (!taskStore.markComplete(description)) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok("Task '" + description + "' marked as complete.");
    }
}
