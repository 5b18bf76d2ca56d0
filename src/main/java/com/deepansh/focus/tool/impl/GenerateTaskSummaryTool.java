package com.deepansh.focus.tool.impl;

import com.deepansh.focus.task.TaskStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stores a short display label for a task. The model writes the summary; this tool only
 * checks that it is short and saves it.
 */
@Component
public class GenerateTaskSummaryTool extends JsonArgumentsTool {

    static final int MAX_SUMMARY_WORDS = 8;

    private final TaskStore taskStore;

    public GenerateTaskSummaryTool(ObjectMapper objectMapper, TaskStore taskStore) {
        super(objectMapper);
        this.taskStore = taskStore;
    }

    @Override
    public String getName() {
        return "generateTaskSummary";
    }

    @Override
    public String getDescription() {
        return "Generates a short (3-5 word) summary for a task. Useful for long task descriptions that need concise display.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "taskDescription", stringProperty("The full task description to summarize."),
                "summary", stringProperty("A short 3-5 word summary of the task. Should capture the essence of the task.")
        ), "taskDescription", "summary");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String description = args.requireString("taskDescription");
        String summary = args.requireString("summary");
        int words = summary.split("\\s+").length;
        if (words > MAX_SUMMARY_WORDS) {
            return ToolResult.error("Summary is too long (" + words + " words). Use 3-5 words.");
        }
        if (!taskStore.update(description, task -> task.setSummary(summary))) {
            return TaskMessages.notFound(description);
        }
        return ToolResult.ok("Summary for task '" + description + "' set to '" + summary + "'.");
    }
}
