package com.deepansh.focus.core;

import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.TurnResult;

import java.util.List;

/**
 * Hooks the orchestrator calls after state changes, used for persistence and tracing.
 * A listener failure is logged by the orchestrator and never changes the turn's result.
 */
public interface TurnListener {

    /** The store now holds {@code history}; called after every successful commit. */
    default void conversationChanged(String sessionId, List<Message> history) {
    }

    /** The conversation was cleared back to its system message. */
    default void conversationReset(String sessionId) {
    }

    /** Every turn ends here once, whatever its outcome. */
    default void turnFinished(TurnContext context, TurnResult result) {
    }

    TurnListener NONE = new TurnListener() {
    };
}
