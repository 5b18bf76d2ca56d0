package com.deepansh.focus.backend;

import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.tool.ToolDefinition;

import java.util.List;

/**
 * A model endpoint the orchestrator can talk to.
 *
 * Each implementation owns its wire format and maps every failure onto
 * {@link com.deepansh.focus.model.ErrorKind}. {@link #send} does not throw for
 * backend problems; it returns {@link BackendOutcome#failure}.
 */
public interface BackendAdapter {

    /** Stable id referenced by the capability ladder, e.g. "cloud". */
    String id();

    /**
     * Sends one request. An empty tool list means the backend must answer in text.
     */
    BackendOutcome send(List<Message> window, List<ToolDefinition> tools);
}
