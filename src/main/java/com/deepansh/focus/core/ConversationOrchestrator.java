package com.deepansh.focus.core;

import com.deepansh.focus.backend.BackendAdapter;
import com.deepansh.focus.conversation.ConversationStore;
import com.deepansh.focus.degradation.CapabilityTier;
import com.deepansh.focus.degradation.DegradationController;
import com.deepansh.focus.degradation.DegradationLadder;
import com.deepansh.focus.exception.TurnInProgressException;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import com.deepansh.focus.model.TurnResult;
import com.deepansh.focus.tool.ToolDefinition;
import com.deepansh.focus.tool.ToolRegistry;
import com.deepansh.focus.tool.ToolResult;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one chat session: turns a user message into backend sends and tool runs
 * until the model answers in text.
 *
 * Per-turn flow:
 * 1. Stage the user message
 * 2. Send the truncated history to the current tier's backend
 * 3. Text: stage it and commit the turn
 * 4. Tool calls: stage the request, run the tools concurrently, stage their results
 *    in request order, go back to 2 (bounded by maxToolRounds)
 * 5. Backend failure: move down the ladder and resend the same staged history
 *
 * Nothing reaches the conversation store until the turn succeeds, so a failed or
 * cancelled turn leaves the conversation exactly as it was. Turns of one session are
 * strictly sequential.
 */
@Slf4j
public class ConversationOrchestrator {

    private final String sessionId;
    private final ConversationStore store;
    private final ToolRegistry toolRegistry;
    private final Map<String, BackendAdapter> backends;
    private final DegradationLadder ladder;
    private final int maxToolRounds;
    private final long toolTimeoutMs;
    private final Executor turnExecutor;
    private final AsyncTaskExecutor toolExecutor;
    private final TurnListener listener;

    private final AtomicReference<TurnHandle> activeTurn = new AtomicReference<>();

    @Builder
    public ConversationOrchestrator(String sessionId,
                                    ConversationStore store,
                                    ToolRegistry toolRegistry,
                                    Map<String, BackendAdapter> backends,
                                    DegradationLadder ladder,
                                    int maxToolRounds,
                                    long toolTimeoutMs,
                                    Executor turnExecutor,
                                    AsyncTaskExecutor toolExecutor,
                                    TurnListener listener) {
        this.sessionId = sessionId;
        this.store = store;
        this.toolRegistry = toolRegistry;
        this.backends = Map.copyOf(backends);
        this.ladder = ladder;
        this.maxToolRounds = maxToolRounds;
        this.toolTimeoutMs = toolTimeoutMs;
        this.turnExecutor = turnExecutor;
        this.toolExecutor = toolExecutor;
        this.listener = listener != null ? listener : TurnListener.NONE;
    }

    /**
     * Starts a turn on the turn executor and returns immediately.
     *
     * @throws TurnInProgressException if this session already has a turn in flight
     */
    public TurnHandle submit(String userInput) {
        TurnHandle handle = claim();
        try {
            turnExecutor.execute(() -> run(handle, userInput, true));
        } catch (RuntimeException e) {
            activeTurn.compareAndSet(handle, null);
            throw e;
        }
        return handle;
    }

    /**
     * Runs a turn on the calling thread.
     *
     * @throws TurnInProgressException if this session already has a turn in flight
     */
    public TurnResult process(String userInput) {
        TurnHandle handle = claim();
        run(handle, userInput, false);
        return handle.result().join();
    }

    /** Cancels the turn in flight, if any. */
    public boolean cancel() {
        TurnHandle handle = activeTurn.get();
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel();
        if (cancelled) {
            log.info("Turn cancellation requested [session={}]", sessionId);
        }
        return cancelled;
    }

    public boolean isBusy() {
        return activeTurn.get() != null;
    }

    public List<Message> history() {
        return store.fullHistory();
    }

    /**
     * Clears the conversation back to its system message.
     *
     * @throws TurnInProgressException if a turn is in flight
     */
    public void reset() {
        TurnHandle handle = claim();
        try {
            store.reset();
            log.info("Conversation reset [session={}]", sessionId);
            notifyListener(() -> listener.conversationReset(sessionId));
        } finally {
            activeTurn.compareAndSet(handle, null);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    private TurnHandle claim() {
        TurnHandle handle = new TurnHandle(sessionId);
        if (!activeTurn.compareAndSet(null, handle)) {
            throw new TurnInProgressException(sessionId);
        }
        return handle;
    }

    /**
     * @param pooled true when the runner is a turn executor thread rather than the caller's own
     */
    private void run(TurnHandle handle, String userInput, boolean pooled) {
        handle.attach(Thread.currentThread());
        TurnContext context = new TurnContext(sessionId, userInput);
        TurnResult result;
        try {
            result = runTurn(handle, context);
        } catch (RuntimeException e) {
            log.error("Turn crashed [session={}]", sessionId, e);
            context.setState(TurnState.FAILED);
            context.markFinished();
            activeTurn.compareAndSet(handle, null);
            handle.fail(e);
            return;
        } finally {
            handle.detach();
            // a pooled runner must not carry a late interrupt into its next task; a caller
            // keeps any interrupt that did not come from cancelling this turn
            boolean interrupted = Thread.interrupted();
            if (interrupted && !pooled && !handle.isCancelled()) {
                Thread.currentThread().interrupt();
            }
        }

        context.markFinished();
        activeTurn.compareAndSet(handle, null);
        TurnResult finished = result;
        notifyListener(() -> listener.turnFinished(context, finished));
        handle.complete(finished);
    }

    private TurnResult runTurn(TurnHandle handle, TurnContext context) {
        log.info("Turn started [session={}, historySize={}]", sessionId, store.size());
        context.getPending().add(Message.user(context.getUserInput()));
        DegradationController degradation = new DegradationController(ladder);
        int backendAttempts = 0;

        while (true) {
            if (handle.isCancelled()) {
                return cancelled(context, degradation.current(), backendAttempts);
            }

            CapabilityTier tier = degradation.current();
            context.setState(TurnState.AWAITING_SEND);
            List<Message> window = store.window(context.getPending());
            List<ToolDefinition> tools = toolRegistry.definitions(tier.getToolNames());

            backendAttempts++;
            log.info("Sending turn [session={}, tier={}, attempt={}, window={}, tools={}]",
                    sessionId, tier.getLabel(), backendAttempts, window.size(), tools.size());
            BackendOutcome outcome = backends.get(tier.getBackendId()).send(window, tools);
            context.recordAttempt(tier.getLabel(), outcome);

            if (handle.isCancelled() || outcome.getFailureKind() == ErrorKind.CANCELLED) {
                return cancelled(context, tier, backendAttempts);
            }

            switch (outcome.getType()) {
                case FAILURE -> {
                    if (!degradation.advance(outcome.getFailureKind())) {
                        return fail(context, ErrorKind.ALL_TIERS_EXHAUSTED, tier, backendAttempts);
                    }
                }
                case TEXT -> {
                    context.getPending().add(Message.assistant(outcome.getContent()));
                    return commit(handle, context, tier, backendAttempts);
                }
                case TOOL_CALLS -> {
                    if (context.getToolRounds() >= maxToolRounds) {
                        log.warn("Tool round limit ({}) reached [session={}]", maxToolRounds, sessionId);
                        return fail(context, ErrorKind.RECURSION_LIMIT_EXCEEDED, tier, backendAttempts);
                    }
                    int round = context.nextToolRound();
                    context.setState(TurnState.EXECUTING_TOOLS);
                    List<ToolCall> calls = outcome.getToolCalls();
                    log.info("Tool round {}/{}: {} call(s) {} [session={}]", round, maxToolRounds, calls.size(),
                            calls.stream().map(ToolCall::getToolName).toList(), sessionId);

                    context.getPending().add(Message.assistantToolCalls(calls));
                    List<Message> results = executeTools(tier, calls, context);
                    if (results == null) {
                        return cancelled(context, tier, backendAttempts);
                    }
                    context.getPending().addAll(results);
                }
            }
        }
    }

    /**
     * Runs all calls of one assistant message concurrently and returns their tool
     * messages in request order. Returns null when the turn was interrupted.
     */
    private List<Message> executeTools(CapabilityTier tier, List<ToolCall> calls, TurnContext context) {
        List<Future<ToolResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(toolExecutor.submit(() -> dispatch(tier, call, context)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(toolTimeoutMs);
        List<Message> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            ToolResult result;
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                result = futures.get(i).get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                futures.get(i).cancel(true);
                log.warn("Tool [{}] exceeded {}ms [session={}]", call.getToolName(), toolTimeoutMs, sessionId);
                result = ToolResult.error(call.getToolName() + " timed out");
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                return null;
            } catch (ExecutionException e) {
                log.error("Tool [{}] crashed [session={}]", call.getToolName(), sessionId, e.getCause());
                result = ToolResult.error(call.getToolName() + " failed");
            }
            results.add(Message.tool(call.getId(), call.getToolName(), result.getText()));
        }
        return results;
    }

    private ToolResult dispatch(CapabilityTier tier, ToolCall call, TurnContext context) {
        long start = System.currentTimeMillis();
        ToolResult result;
        if (toolRegistry.hasTool(call.getToolName()) && !tier.getToolNames().contains(call.getToolName())) {
            log.warn("Model called [{}] which tier [{}] does not offer", call.getToolName(), tier.getLabel());
            result = ToolResult.error("tool not available right now: " + call.getToolName());
        } else {
            result = toolRegistry.execute(call);
        }
        context.recordToolCall(call.getToolName(), System.currentTimeMillis() - start,
                result.isSuccess(), result.getText());
        return result;
    }

    private TurnResult commit(TurnHandle handle, TurnContext context, CapabilityTier tier, int backendAttempts) {
        List<Message> staged = List.copyOf(context.getPending());
        if (!handle.commit(() -> store.appendAll(staged))) {
            return cancelled(context, tier, backendAttempts);
        }
        context.setState(TurnState.SUCCEEDED);

        List<Message> history = store.fullHistory();
        notifyListener(() -> listener.conversationChanged(sessionId, history));

        log.info("Turn complete [session={}, tier={}, attempts={}, toolRounds={}, latency={}ms, tokens={}]",
                sessionId, tier.getLabel(), backendAttempts, context.getToolRounds(),
                context.elapsedMs(), context.totalTokens());
        Message answer = staged.get(staged.size() - 1);
        return TurnResult.success(answer.getContent(), tier.getLabel(), backendAttempts, context.getToolRounds());
    }

    private TurnResult fail(TurnContext context, ErrorKind kind, CapabilityTier tier, int backendAttempts) {
        context.setState(TurnState.FAILED);
        log.warn("Turn failed with {} [session={}, attempts={}, toolRounds={}, latency={}ms]",
                kind, sessionId, backendAttempts, context.getToolRounds(), context.elapsedMs());
        return TurnResult.failure(kind, tier != null ? tier.getLabel() : null, backendAttempts, context.getToolRounds());
    }

    private TurnResult cancelled(TurnContext context, CapabilityTier tier, int backendAttempts) {
        context.setState(TurnState.FAILED);
        log.info("Turn cancelled, nothing committed [session={}]", sessionId);
        return TurnResult.failure(ErrorKind.CANCELLED, tier.getLabel(), backendAttempts, context.getToolRounds());
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.error("Turn listener failed [session={}]", sessionId, e);
        }
    }
}
