package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class UpdateTaskProjectOrPathTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public UpdateTaskProjectOrPathTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "updateTaskProjectOrPath";
    }

    @Override
    public String getDescription() {
        return "Sets or clears the specific project or path (e.g., 'Paper XYZ', 'LEAD 552') for a task within its category.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The description of the task to assign to a project/path."),
                "projectOrPath", stringProperty("The project/path name to assign. Provide an empty string or null to clear the project/path.")
        ), "taskDescription");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        String project = TaskMessages.clearable(args.optionalString("projectOrPath"));
        if (!taskStore.update(description, task -> task.setProjectOrPath(project))) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok(project == null
                ? "Project/path for task '" + description + "' cleared."
                : "Project/path for task '" + description + "' set to '" + project + "'.");
    }
}
