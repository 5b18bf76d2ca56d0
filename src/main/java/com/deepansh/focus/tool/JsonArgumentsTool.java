package com.deepansh.focus.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Base class for tools whose arguments are a JSON object.
 *
 * Decodes the raw text once, then hands a typed view to {@link #run(ToolArguments)}.
 * Bad arguments and collaborator failures are turned into tool errors here, so
 * subclasses can simply throw.
 */
@Slf4j
public abstract class JsonArgumentsTool implements AgentTool {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    protected final ObjectMapper objectMapper;

    protected JsonArgumentsTool(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract ToolResult run(ToolArguments args);

    @Override
    public final ToolResult execute(String argumentsJson) {
        Map<String, Object> decoded;
        try {
            decoded = argumentsJson == null || argumentsJson.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(argumentsJson, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Undecodable arguments for tool [{}]: {}", getName(), e.getOriginalMessage());
            return ToolResult.error("invalid arguments for " + getName() + ": expected a JSON object");
        }

        try {
            return run(new ToolArguments(decoded == null ? Map.of() : decoded));
        } catch (ToolArgumentException e) {
            return ToolResult.error("invalid arguments for " + getName() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool [{}] failed", getName(), e);
            return ToolResult.error(getName() + " failed: " + describe(e));
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, String... required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", List.of(required));
    }
}
