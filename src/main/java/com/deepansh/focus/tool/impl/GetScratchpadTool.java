package com.deepansh.focus.tool.impl;

import com.deepansh.focus.scratchpad.ScratchpadStore;
import com.deepansh.focus.tool.JsonArgumentsTool;
import com.deepansh.focus.tool.ToolArguments;
import com.deepansh.focus.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class GetScratchpadTool extends JsonArgumentsTool {

    private final ScratchpadStore scratchpad;

    public GetScratchpadTool(ObjectMapper objectMapper, ScratchpadStore scratchpad) {
        super(objectMapper);
        this.scratchpad = scratchpad;
    }

    @Override
    public String getName() {
        return "getScratchpad";
    }

    @Override
    public String getDescription() {
        return "Gets the current contents of the user's scratchpad notes.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of());
    }

    @Override
    protected ToolResult run(ToolArguments args) {
        String notes = scratchpad.read();
        if (notes.isBlank()) {
            return ToolResult.ok("Your scratchpad is currently empty.");
        }
        return ToolResult.ok("Your scratchpad contents:\n\n" + notes);
    }
}
