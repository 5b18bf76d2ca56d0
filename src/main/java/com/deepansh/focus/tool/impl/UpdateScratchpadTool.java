package com.deepansh.focus.tool.impl;

import com.deepansh.focus.scratchpad.ScratchpadStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class UpdateScratchpadTool extends JsonArgumentsTool {

    private final ScratchpadStore scratchpad;

    public UpdateScratchpadTool(ObjectMapper objectMapper, ScratchpadStore scratchpad) {
        super(objectMapper);
        this.scratchpad = scratchpad;
    }

    @Override
    public String getName() {
        return "updateScratchpad";
    }

    @Override
    public String getDescription() {
        return "Updates the contents of the user's scratchpad notes, either replacing them or appending to them.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(
                "content", stringProperty("The new content to save to the scratchpad."),
                "append", Map.of(
                        "type", "boolean",
                        "description", "Append to the existing notes (true) or replace them (false). Default is false.")
        ), "content");
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String content = args.requireString("content");
        if (args.optionalBoolean("append", false)) {
            scratchpad.append(content);
            return ToolResult.ok("Scratchpad appended to successfully.");
        }
        scratchpad.replace(content);
        return ToolResult.ok("Scratchpad updated successfully.");
    }
}
