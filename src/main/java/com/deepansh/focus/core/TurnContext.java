package com.deepansh.focus.core;

import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working state of one turn.
 *
 * Messages produced during the turn are staged in {@link #getPending()} and only reach
 * the conversation store on success. The rest is bookkeeping for logs and traces.
 */
@Getter
public class TurnContext {

    private final String sessionId;
    private final String userInput;
    private final long startTimeMs = System.currentTimeMillis();
    private final List<Message> pending = new ArrayList<>();
    private final List<TierAttempt> attempts = new ArrayList<>();
    private final List<ToolCallRecord> toolCalls = Collections.synchronizedList(new ArrayList<>());

    @Setter
    private TurnState state = TurnState.AWAITING_SEND;
    private int toolRounds;
    private int promptTokens;
    private int completionTokens;
    private volatile long endTimeMs;

    public TurnContext(String sessionId, String userInput) {
        this.sessionId = sessionId;
        this.userInput = userInput;
    }

    void recordAttempt(String tierLabel, BackendOutcome outcome) {
        attempts.add(new TierAttempt(tierLabel, outcome.getType(), outcome.getFailureKind()));
        promptTokens += outcome.getPromptTokens();
        completionTokens += outcome.getCompletionTokens();
    }

    void recordToolCall(String toolName, long latencyMs, boolean success, String result) {
        toolCalls.add(new ToolCallRecord(toolName, latencyMs, success, result));
    }

    int nextToolRound() {
        return ++toolRounds;
    }

    void markFinished() {
        endTimeMs = System.currentTimeMillis();
    }

    /** Time spent so far, or the turn's full duration once it has finished. */
    public long elapsedMs() {
        long end = endTimeMs > 0 ? endTimeMs : System.currentTimeMillis();
        return end - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public record TierAttempt(String tier, BackendOutcome.Type outcome, ErrorKind failure) {}

    public record ToolCallRecord(String toolName, long latencyMs, boolean success, String result) {}
}
