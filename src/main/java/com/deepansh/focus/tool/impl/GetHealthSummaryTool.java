package com.deepansh.focus.tool.impl;

import com.deepansh.focus.health.HealthSummaryProvider;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class GetHealthSummaryTool extends JsonArgumentsTool {

    private final HealthSummaryProvider healthSummary;

    public GetHealthSummaryTool(ObjectMapper objectMapper, HealthSummaryProvider healthSummary) {
        super(objectMapper);
        this.healthSummary = healthSummary;
    }

    @Override
    public String getName() {
        return "getHealthSummary";
    }

    @Override
    public String getDescription() {
        return "Gets basic health data (sleep, activity, heart rate) to provide ADHD-specific task "
                + "recommendations based on the user's current physical state.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of());
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        return ToolResult.ok(healthSummary.summary());
    }
}
