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
 * One-shot tidy-up of the to-do list.
 *
 * Reordering happens here; metadata and summaries are only reported, with a pointer to the
 * tool that fills them, since their values have to come from the model.
 */
@Component
public class OrganizeAndCleanupTool extends JsonArgumentsTool {

    /** Descriptions longer than this many words should carry a summary. */
    static final int LONG_TASK_WORDS = 6;

    private final TaskStore taskStore;

    public OrganizeAndCleanupTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "organizeAndCleanup";
    }

    @Override
    public String getDescription() {
        return "Organizes the whole to-do list: moves completed tasks below open ones and reports tasks "
                + "that are missing metadata or a short summary.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "includeMetadataEnrichment", booleanProperty("Whether to report tasks missing duration, difficulty or category."),
                "includeSummaryGeneration", booleanProperty("Whether to report long tasks that have no short summary."),
                "includeEmojiUpdates", booleanProperty("Whether to update project emojis (not supported, reported as skipped)."),
                "includePriorityOptimization", booleanProperty("Whether to move completed tasks below open ones.")
        ));
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        List<String> report = new ArrayList<>();

        if (args.optionalBoolean("includePriorityOptimization", true)) {
            int moved = taskStore.moveCompletedToEnd();
            report.add(moved > 0
                    ? "Moved " + moved + " completed task(s) below your open tasks."
                    : "Task order already puts open tasks first.");
        }

        List<TodoItem> open = taskStore.list().stream().filter(task -> !task.isDone()).toList();

        if (args.optionalBoolean("includeMetadataEnrichment", true)) {
            List<String> missing = new ArrayList<>();
            for (TodoItem task : open) {
                List<String> gaps = gaps(task);
                if (!gaps.isEmpty()) {
                    missing.add(task.getText() + " (" + String.join(", ", gaps) + ")");
                }
            }
            report.add(missing.isEmpty()
                    ? "All open tasks have duration, difficulty and category."
                    : "Tasks missing metadata: " + String.join("; ", missing) + ". Use enrichTaskMetadata to fill them.");
        }

        if (args.optionalBoolean("includeSummaryGeneration", true)) {
            List<String> unsummarized = open.stream()
                    .filter(task -> task.getSummary() == null && wordCount(task.getText()) > LONG_TASK_WORDS)
                    .map(TodoItem::getText)
                    .toList();
            report.add(unsummarized.isEmpty()
                    ? "No long tasks need a summary."
                    : "Long tasks without a summary: " + String.join("; ", unsummarized)
                            + ". Use generateTaskSummary for each.");
        }

        if (args.optionalBoolean("includeEmojiUpdates", false)) {
            report.add("Project emojis are not supported, skipped.");
        }

        if (report.isEmpty()) {
            return ToolResult.ok("Nothing to do: every cleanup step was turned off.");
        }
        return ToolResult.ok(String.join("\n", report));
    }

    private static List<String> gaps(TodoItem task) {
        List<String> gaps = new ArrayList<>(3);
        if (task.getEstimatedDuration() == null) {
            gaps.add("duration");
        }
        if (task.getDifficulty() == null) {
            gaps.add("difficulty");
        }
        if (task.getCategory() == null) {
            gaps.add("category");
        }
        return gaps;
    }

    private static int wordCount(String text) {
        return text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }

    private static Map<String, Object> booleanProperty(String description) {
        return Map.of("type", "boolean", "description", description);
    }
}
