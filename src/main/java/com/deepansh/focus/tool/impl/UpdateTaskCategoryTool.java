package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class UpdateTaskCategoryTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public UpdateTaskCategoryTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "updateTaskCategory";
    }

    @Override
    public String getDescription() {
        return "Sets or clears the category (e.g., Research, Teaching, Life) for a specific task.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The description of the task to categorize."),
                "category", stringProperty("The category name to assign. Provide an empty string or null to clear the category.")
        ), "taskDescription");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        String category = TaskMessages.clearable(args.optionalString("category"));
        if (!taskStore.update(description, task -> task.setCategory(category))) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok(category == null
                ? "Category for task '" + description + "' cleared."
                : "Category for task '" + description + "' set to '" + category + "'.");
    }
}
