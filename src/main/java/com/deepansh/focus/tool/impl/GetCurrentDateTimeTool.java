package com.deepansh.focus.tool.impl;

import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Component
public class GetCurrentDateTimeTool extends JsonArgumentsTool {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' h:mm a z", Locale.US);

    private final Clock clock;

    @Autowired
    public GetCurrentDateTimeTool(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    GetCurrentDateTimeTool(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper);
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "getCurrentDateTime";
    }

    @Override
    public String getDescription() {
        return "Gets the current date and time.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of());
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        return ToolResult.ok("Current date and time: " + FORMAT.format(ZonedDateTime.now(clock)));
    }
}
