package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.Difficulty;
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
import java.util.Optional;

/**
 * Bulk fill of missing task metadata.
 *
 * Only empty fields are written, so values the user set explicitly survive an enrichment
 * pass. Each update is applied on its own; one unknown task does not stop the others.
 */
@Component
public class EnrichTaskMetadataTool extends JsonArgumentsTool {

    private final TaskStore taskStore;

    public EnrichTaskMetadataTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "enrichTaskMetadata";
    }

    @Override
    public String getDescription() {
        return "Fills in missing metadata (duration, difficulty, category, project/path) for several tasks at once. "
                + "Fields that already have a value are left unchanged.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "updates", Map.of(
                        "type", "array",
                        "description", "Metadata updates. Each has taskDescription (required) and optionally "
                                + "estimatedDuration, difficulty (Low, Medium, High), category, projectOrPath.",
                        "items", Map.of("type", "object"))
        ), "updates");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        List<ToolArguments> updates = args.requireObjectList("updates");
        List<String> lines = new ArrayList<>(updates.size());
        int matched = 0;

        for (ToolArguments update : updates) {
            String description = update.requireString("taskDescription");
            String difficultyLabel = update.optionalString("difficulty");
            Optional<Difficulty> difficulty = Difficulty.fromLabel(difficultyLabel);
            if (difficultyLabel != null && !difficultyLabel.isBlank() && difficulty.isEmpty()) {
                lines.add("Task '" + description + "': invalid difficulty '" + difficultyLabel + "'. Use: Low, Medium, or High.");
                continue;
            }

            List<String> filled = new ArrayList<>();
            boolean found = taskStore.update(description, task -> fillMissing(task, update, difficulty, filled));
            if (!found) {
                lines.add("Could not find task: '" + description + "'");
                continue;
            }
            matched++;
            lines.add(filled.isEmpty()
                    ? "Task '" + description + "' already had this metadata."
                    : "Task '" + description + "': filled " + String.join(", ", filled) + ".");
        }

        String report = String.join("\n", lines);
        return matched > 0 ? ToolResult.ok(report) : ToolResult.error(report);
    }

    private static void fillMissing(TodoItem task, ToolArguments update, Optional<Difficulty> difficulty,
                                    List<String> filled) {
        String duration = TaskMessages.clearable(update.optionalString("estimatedDuration"));
        if (duration != null && task.getEstimatedDuration() == null) {
            task.setEstimatedDuration(duration);
            filled.add("duration");
        }
        if (difficulty.isPresent() && task.getDifficulty() == null) {
            task.setDifficulty(difficulty.get());
            filled.add("difficulty");
        }
        String category = TaskMessages.clearable(update.optionalString("category"));
        if (category != null && task.getCategory() == null) {
            task.setCategory(category);
            filled.add("category");
        }
        String project = TaskMessages.clearable(update.optionalString("projectOrPath"));
        if (project != null && task.getProjectOrPath() == null) {
            task.setProjectOrPath(project);
            filled.add("project");
        }
    }
}
