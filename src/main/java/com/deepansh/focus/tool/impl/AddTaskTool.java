package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AddTaskTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public AddTaskTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "addTaskToList";
    }

    @Override
    public String getDescription() {
        return "Adds a task to the user's to-do list. Optionally assigns it to a project/path and/or category.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("A description of the task to be added."),
                "projectOrPath", stringProperty("The project or path to assign the task to (optional)."),
                "category", stringProperty("The category to assign the task to (optional).")
        ), "taskDescription");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        taskStore.add(description, args.optionalString("projectOrPath"), args.optionalString("category"));
        return ToolResult.ok("Task '" + description + "' added successfully.");
    }
}
