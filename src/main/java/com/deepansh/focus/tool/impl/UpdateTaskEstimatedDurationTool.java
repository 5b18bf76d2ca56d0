package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class UpdateTaskEstimatedDurationTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public UpdateTaskEstimatedDurationTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "updateTaskEstimatedDuration";
    }

    @Override
    public String getDescription() {
        return "Updates the estimated duration for a specific task on the to-do list.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The description of the task whose duration needs to be updated."),
                "estimatedDuration", stringProperty("The estimated duration for the task (e.g., '~15 mins', '1 hour', 'quick').")
        ), "taskDescription", "estimatedDuration");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        String duration = args.requireString("estimatedDuration");
        if (!taskStore.update(description, task -> task.setEstimatedDuration(duration))) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok("Estimated duration for task '" + description + "' updated to '" + duration + "'.");
    }
}
