package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.Difficulty;
import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class UpdateTaskDifficultyTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public UpdateTaskDifficultyTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "updateTaskDifficulty";
    }

    @Override
    public String getDescription() {
        return "Updates the estimated difficulty (Low, Medium, High) for a specific task.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The description of the task whose difficulty needs to be updated."),
                "difficulty", Map.of(
                        "type", "string",
                        "enum", List.of("Low", "Medium", "High"),
                        "description", "The estimated difficulty level: Low, Medium, High")
        ), "taskDescription", "difficulty");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        Optional<Difficulty> difficulty = Difficulty.fromLabel(args.requireString("difficulty"));
        if (difficulty.isEmpty()) {
            return ToolResult.error("Invalid difficulty level. Use: Low, Medium, or High.");
        }
        if (!taskStore.update(description, task -> task.setDifficulty(difficulty.get()))) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok("Difficulty for task '" + description + "' updated to '" + difficulty.get().label() + "'.");
    }
}
