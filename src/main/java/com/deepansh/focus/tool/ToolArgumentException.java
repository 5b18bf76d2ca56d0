package com.deepansh.focus.tool;

/**
 * Raised while decoding tool arguments. Converted to a tool error by {@link JsonArgumentsTool}.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
