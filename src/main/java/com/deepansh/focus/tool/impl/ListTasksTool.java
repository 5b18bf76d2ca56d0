package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.task.TodoItem;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists the to-do list in priority order, with whatever metadata each task has.
 *
 * Output format (optimized for LLM consumption):
 *   1. ○ Write intro [Duration: ~30 mins, Category: Research]
 *   2. ✓ Email advisor
 */
@Component
public class ListTasksTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public ListTasksTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "listCurrentTasks";
    }

    @Override
    public String getDescription() {
        return "Gets the current list of tasks from the user's to-do list.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of());
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        List<TodoItem> tasks = taskStore.list();
        if (tasks.isEmpty()) {
            return ToolResult.ok("You have no tasks in your to-do list.");
        }

        StringBuilder sb = new StringBuilder("Here are your current tasks:\n\n");
        for (int i = 0; i < tasks.size(); i++) {
            TodoItem task = tasks.get(i);
            sb.append(i + 1).append(". ")
                    .append(task.isDone() ? "✓ " : "○ ")
                    .append(task.getText());
            String metadata = metadata(task);
            if (!metadata.isEmpty()) {
                sb.append(" [").append(metadata).append(']');
            }
            sb.append('\n');
        }
        return ToolResult.ok(sb.toString().trim());
    }

    private static String metadata(TodoItem task) {
        List<String> parts = new ArrayList<>();
        if (task.getSummary() != null) {
            parts.add("Summary: " + task.getSummary());
        }
        if (task.getEstimatedDuration() != null) {
            parts.add("Duration: " + task.getEstimatedDuration());
        }
        if (task.getProjectOrPath() != null) {
            parts.add("Project: " + task.getProjectOrPath());
        }
        if (task.getCategory() != null) {
            parts.add("Category: " + task.getCategory());
        }
        if (task.getDifficulty() != null) {
            parts.add("Difficulty: " + task.getDifficulty().label());
        }
        return String.join(", ", parts);
    }
}
