package com.deepansh.focus.observability;

import com.deepansh.focus.core.TurnContext;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.TurnResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists turn traces.
 *
 * Persistence is @Async; it never delays the chat reply, and a failure here is
 * logged without touching the turn's outcome.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final TurnTraceRepository traceRepository;

    @Async("traceTaskExecutor")
    public void persistTrace(TurnContext context, TurnResult result) {
        try {
            TurnTrace trace = toTrace(context, result);
            traceRepository.save(trace);
            log.info("Trace persisted [session={}, status={}, latency={}ms, tokens={}]",
                    context.getSessionId(), trace.getStatus(), trace.getTotalLatencyMs(), trace.getTotalTokens());
        } catch (RuntimeException e) {
            log.error("Failed to persist turn trace for session={}", context.getSessionId(), e);
        }
    }

    public List<TurnTrace> tracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    TurnTrace toTrace(TurnContext context, TurnResult result) {
        TurnTrace.Status status;
        if (result.isSuccess()) {
            status = TurnTrace.Status.SUCCESS;
        } else if (result.getErrorKind() == ErrorKind.CANCELLED) {
            status = TurnTrace.Status.CANCELLED;
        } else {
            status = TurnTrace.Status.FAILED;
        }

        List<TurnTrace.Attempt> attempts = context.getAttempts().stream()
                .map(a -> new TurnTrace.Attempt(a.tier(), a.outcome().name(),
                        a.failure() != null ? a.failure().name() : null))
                .toList();

        List<TurnTrace.ToolInvocation> toolCalls;
        synchronized (context.getToolCalls()) {
            toolCalls = context.getToolCalls().stream()
                    .map(r -> new TurnTrace.ToolInvocation(r.toolName(), r.latencyMs(), r.success(),
                            truncate(r.result(), 200)))
                    .toList();
        }

        return TurnTrace.builder()
                .sessionId(context.getSessionId())
                .userInput(truncate(context.getUserInput(), 4000))
                .finalAnswer(truncate(result.getFinalText(), 8000))
                .status(status)
                .errorKind(result.getErrorKind() != null ? result.getErrorKind().name() : null)
                .finalTier(result.getTier())
                .backendAttempts(result.getBackendAttempts())
                .toolRounds(result.getToolRounds())
                .totalLatencyMs(context.elapsedMs())
                .promptTokens(context.getPromptTokens())
                .completionTokens(context.getCompletionTokens())
                .totalTokens(context.totalTokens())
                .attempts(attempts)
                .toolCalls(toolCalls)
                .build();
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
