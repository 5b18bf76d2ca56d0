package com.deepansh.focus.tool.impl;

import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Round-trip check that tool calling works end to end, on any backend.
 */
@Component
public class VerifySystemTool extends JsonArgumentsTool {

    public VerifySystemTool(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getName() {
        return "verifySystem";
    }

    @Override
    public String getDescription() {
        return "Verifies that the assistant's tool system is working. Echoes the message with a timestamp.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "message", stringProperty("Message to verify with.")
        ), "message");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String message = args.requireString("message");
        return ToolResult.ok("System verification successful. Message: '" + message + "' at " + Instant.now());
    }
}
