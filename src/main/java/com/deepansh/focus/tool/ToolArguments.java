package com.deepansh.focus.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed view over a decoded arguments object.
 */
public class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    public String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new ToolArgumentException("missing required field '" + name + "'");
        }
        return value;
    }

    /** Returns null when the field is absent. Blank strings are kept. */
    public String optionalString(String name) {
        Object raw = values.get(name);
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s) {
            return s.trim();
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        throw new ToolArgumentException("field '" + name + "' must be a string");
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        Object raw = values.get(name);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        throw new ToolArgumentException("field '" + name + "' must be a boolean");
    }

    public List<String> requireStringList(String name) {
        Object raw = values.get(name);
        if (!(raw instanceof Collection<?> items) || items.isEmpty()) {
            throw new ToolArgumentException("field '" + name + "' must be a non-empty array of strings");
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String s) || s.isBlank()) {
                throw new ToolArgumentException("field '" + name + "' must only contain non-blank strings");
            }
            result.add(s.trim());
        }
        return result;
    }

    /** Each element must be a JSON object; returns a typed view per element. */
    @SuppressWarnings("unchecked")
    public List<ToolArguments> requireObjectList(String name) {
        Object raw = values.get(name);
        if (!(raw instanceof Collection<?> items) || items.isEmpty()) {
            throw new ToolArgumentException("field '" + name + "' must be a non-empty array of objects");
        }
        List<ToolArguments> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> object)) {
                throw new ToolArgumentException("field '" + name + "' must only contain objects");
            }
            result.add(new ToolArguments((Map<String, Object>) object));
        }
        return result;
    }
}
