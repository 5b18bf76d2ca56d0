package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RemoveTaskTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public RemoveTaskTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "removeTaskFromList";
    }

    @Override
    public String getDescription() {
        return "Removes a specific task from the user's to-do list based on its description.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The exact description of the task to remove.")
        ), "taskDescription");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        if (!taskStore.remove(description)) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok("Task '" + description + "' removed successfully.");
    }
}
