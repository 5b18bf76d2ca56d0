package com.deepansh.focus.core;

import com.deepansh.focus.backend.BackendAdapter;
import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.conversation.ConversationRepository;
import com.deepansh.focus.conversation.ConversationStore;
import com.deepansh.focus.degradation.DegradationLadder;
import com.deepansh.focus.exception.SessionNotFoundException;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.TurnResult;
import com.deepansh.focus.observability.TraceService;
import com.deepansh.focus.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns one orchestrator per chat session.
 *
 * Per-session flow:
 * 1. First use: build a store and restore the persisted log (repaired if needed)
 * 2. Every committed turn: persist the full log to Redis
 * 3. Every finished turn: record a trace asynchronously
 * 4. Idle for longer than session-idle-timeout-ms, or reset: dropped from memory; the
 *    next use reloads it from Redis
 *
 * A session is only dropped while no request holds it, so one session never has two
 * orchestrators at once.
 *
 * Persistence failures are logged and do not fail the turn; the in-memory log stays
 * authoritative and the next commit rewrites the stored copy.
 */
@Service
@Slf4j
public class ChatSessionService implements TurnListener {

    private final FocusProperties properties;
    private final ToolRegistry toolRegistry;
    private final Map<String, BackendAdapter> backends;
    private final DegradationLadder ladder;
    private final ConversationRepository conversationRepository;
    private final TraceService traceService;
    private final AsyncTaskExecutor turnExecutor;
    private final AsyncTaskExecutor toolExecutor;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Autowired
    public ChatSessionService(FocusProperties properties,
                              ToolRegistry toolRegistry,
                              List<BackendAdapter> backendBeans,
                              ConversationRepository conversationRepository,
                              TraceService traceService,
                              @Qualifier("turnTaskExecutor") AsyncTaskExecutor turnExecutor,
                              @Qualifier("toolTaskExecutor") AsyncTaskExecutor toolExecutor) {
        this(properties, toolRegistry, backendBeans, conversationRepository, traceService,
                turnExecutor, toolExecutor, Clock.systemUTC());
    }

    ChatSessionService(FocusProperties properties,
                       ToolRegistry toolRegistry,
                       List<BackendAdapter> backendBeans,
                       ConversationRepository conversationRepository,
                       TraceService traceService,
                       AsyncTaskExecutor turnExecutor,
                       AsyncTaskExecutor toolExecutor,
                       Clock clock) {
        this.properties = properties;
        this.toolRegistry = toolRegistry;
        this.backends = backendBeans.stream()
                .collect(Collectors.toUnmodifiableMap(BackendAdapter::id, Function.identity()));
        this.ladder = DegradationLadder.fromProperties(
                properties.getLadder(), backends.keySet(), toolRegistry.toolNames());
        this.conversationRepository = conversationRepository;
        this.traceService = traceService;
        this.turnExecutor = turnExecutor;
        this.toolExecutor = toolExecutor;
        this.clock = clock;
    }

    /**
     * Runs one user message to completion. A blank or missing session id starts a new session.
     * If the waiting thread is interrupted the turn is cancelled and reported as such.
     */
    public SessionTurn chat(String sessionId, String input) {
        evictIdleSessions();
        String resolved = resolveSessionId(sessionId);
        ConversationOrchestrator orchestrator = acquire(resolved);
        try {
            TurnHandle handle = orchestrator.submit(input);
            try {
                return new SessionTurn(resolved, handle.await());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!handle.cancel() && handle.result().isDone() && !handle.result().isCompletedExceptionally()) {
                    return new SessionTurn(resolved, handle.result().join());
                }
                log.warn("Request thread interrupted, turn cancelled [session={}]", resolved);
                return new SessionTurn(resolved, TurnResult.failure(ErrorKind.CANCELLED, null, 0, 0));
            }
        } finally {
            release(resolved);
        }
    }

    public boolean cancel(String sessionId) {
        Session session = sessions.get(sessionId);
        return session != null && session.orchestrator.cancel();
    }

    public List<Message> history(String sessionId) {
        ConversationOrchestrator orchestrator = acquireExisting(sessionId);
        try {
            return orchestrator.history();
        } finally {
            release(sessionId);
        }
    }

    public void reset(String sessionId) {
        ConversationOrchestrator orchestrator = acquireExisting(sessionId);
        try {
            orchestrator.reset();
        } finally {
            release(sessionId);
        }
        sessions.computeIfPresent(sessionId, (id, session) -> session.isUnused() ? null : session);
    }

    /**
     * Drops sessions that nobody holds and that have been idle past the configured timeout.
     */
    public void evictIdleSessions() {
        long cutoff = clock.millis() - properties.getConversation().getSessionIdleTimeoutMs();
        for (String sessionId : sessions.keySet()) {
            sessions.computeIfPresent(sessionId, (id, session) -> {
                if (session.isUnused() && session.lastUsedMillis < cutoff) {
                    log.info("Evicting idle session [session={}]", id);
                    return null;
                }
                return session;
            });
        }
    }

    int cachedSessionCount() {
        return sessions.size();
    }

    @Override
    public void conversationChanged(String sessionId, List<Message> history) {
        try {
            conversationRepository.save(sessionId, history);
        } catch (RuntimeException e) {
            log.error("Could not persist conversation [session={}, size={}]", sessionId, history.size(), e);
        }
    }

    @Override
    public void conversationReset(String sessionId) {
        try {
            conversationRepository.delete(sessionId);
        } catch (RuntimeException e) {
            log.error("Could not delete stored conversation [session={}]", sessionId, e);
        }
    }

    @Override
    public void turnFinished(TurnContext context, TurnResult result) {
        traceService.persistTrace(context, result);
    }

    private ConversationOrchestrator acquireExisting(String sessionId) {
        if (!sessions.containsKey(sessionId) && !conversationRepository.exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return acquire(sessionId);
    }

    /**
     * Returns the session's orchestrator and marks it held until {@link #release}.
     * The persisted log is loaded outside the map so Redis latency never blocks other sessions.
     */
    private ConversationOrchestrator acquire(String sessionId) {
        Session held = sessions.computeIfPresent(sessionId, (id, session) -> session.hold(clock.millis()));
        if (held != null) {
            return held.orchestrator;
        }
        ConversationOrchestrator created = createOrchestrator(sessionId);
        return sessions.compute(sessionId, (id, session) ->
                (session != null ? session : new Session(created)).hold(clock.millis())).orchestrator;
    }

    private void release(String sessionId) {
        sessions.computeIfPresent(sessionId, (id, session) -> session.release(clock.millis()));
    }

    private ConversationOrchestrator createOrchestrator(String sessionId) {
        FocusProperties.Conversation conversation = properties.getConversation();
        ConversationStore store = new ConversationStore(conversation.getSystemPrompt(), conversation.getMaxRecent());

        List<Message> persisted = conversationRepository.load(sessionId);
        if (!persisted.isEmpty()) {
            store.load(persisted);
            log.info("Restored conversation [session={}, messages={}]", sessionId, store.size());
        } else {
            log.info("New conversation [session={}]", sessionId);
        }

        return ConversationOrchestrator.builder()
                .sessionId(sessionId)
                .store(store)
                .toolRegistry(toolRegistry)
                .backends(backends)
                .ladder(ladder)
                .maxToolRounds(properties.getOrchestrator().getMaxToolRounds())
                .toolTimeoutMs(properties.getOrchestrator().getToolTimeoutMs())
                .turnExecutor(turnExecutor)
                .toolExecutor(toolExecutor)
                .listener(this)
                .build();
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }

    public record SessionTurn(String sessionId, TurnResult result) {}

    /** Mutated only inside the map's compute functions. */
    private static final class Session {

        private final ConversationOrchestrator orchestrator;
        private int holders;
        private long lastUsedMillis;

        Session(ConversationOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
        }

        Session hold(long now) {
            holders++;
            lastUsedMillis = now;
            return this;
        }

        Session release(long now) {
            holders--;
            lastUsedMillis = now;
            return this;
        }

        boolean isUnused() {
            return holders == 0 && !orchestrator.isBusy();
        }
    }
}
