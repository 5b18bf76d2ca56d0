package com.deepansh.focus.core;

import com.deepansh.focus.backend.BackendAdapter;
import com.deepansh.focus.backend.ResilientBackendAdapter;
import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.conversation.ConversationStore;
import com.deepansh.focus.degradation.CapabilityTier;
import com.deepansh.focus.degradation.DegradationLadder;
import com.deepansh.focus.exception.TurnInProgressException;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import com.deepansh.focus.model.TurnResult;
import com.deepansh.focus.tool.AgentTool;
import com.deepansh.focus.tool.ToolDefinition;
import com.deepansh.focus.tool.ToolRegistry;
import com.deepansh.focus.tool.ToolResult;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationOrchestratorTest {

    private static final String SYSTEM_PROMPT = "You are a focus assistant.";

    private final List<String> addedTasks = new CopyOnWriteArrayList<>();
    private final CountDownLatch pairLatch = new CountDownLatch(2);

    private FakeBackend cloud;
    private FakeBackend onDevice;
    private ConversationStore store;
    private ToolRegistry registry;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        cloud = new FakeBackend("cloud");
        onDevice = new FakeBackend("on-device");
        store = new ConversationStore(SYSTEM_PROMPT, 20);
        listener = new RecordingListener();
        registry = new ToolRegistry(List.of(
                new FakeTool("addTaskToList", args -> {
                    addedTasks.add(args);
                    return ToolResult.ok("Task 'Buy milk' added successfully.");
                }),
                new FakeTool("listCurrentTasks", args -> ToolResult.ok("You have no tasks in your to-do list.")),
                new FakeTool("brokenTool", args -> ToolResult.error("brokenTool failed: disk full")),
                new FakeTool("sleepyTool", args -> {
                    sleepQuietly(5_000);
                    return ToolResult.ok("finally awake");
                }),
                new FakeTool("pairedTool", args -> {
                    pairLatch.countDown();
                    return awaitQuietly(pairLatch) ? ToolResult.ok("ran with partner " + args)
                            : ToolResult.error("ran alone " + args);
                })));
    }

    @Test
    void process_addTask_runsToolThenCommitsWholeTurn() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(call("c1", "addTaskToList", "{\"taskDescription\":\"Buy milk\"}"))),
                BackendOutcome.text("Added 'Buy milk' to your list."));

        TurnResult result = orchestrator(5).process("add buy milk");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFinalText()).isEqualTo("Added 'Buy milk' to your list.");
        assertThat(result.getTier()).isEqualTo("cloud-full");
        assertThat(result.getBackendAttempts()).isEqualTo(2);
        assertThat(result.getToolRounds()).isEqualTo(1);
        assertThat(addedTasks).containsExactly("{\"taskDescription\":\"Buy milk\"}");

        List<Message> history = store.fullHistory();
        assertThat(history).extracting(Message::getRole).containsExactly(
                Message.Role.system, Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
        assertThat(history.get(3).getToolCallId()).isEqualTo("c1");
        assertThat(history.get(3).getContent()).isEqualTo("Task 'Buy milk' added successfully.");
        assertThat(listener.changed).hasSize(1);
        assertThat(listener.finished).containsExactly(result);
    }

    @Test
    void process_secondSendSeesToolResultsInWindow() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(call("c1", "listCurrentTasks", "{}"))),
                BackendOutcome.text("Your list is empty."));

        orchestrator(5).process("what's on my list?");

        List<Message> secondWindow = cloud.windows.get(1);
        assertThat(secondWindow.get(secondWindow.size() - 1).getContent())
                .isEqualTo("You have no tasks in your to-do list.");
        assertThat(cloud.tools.get(0)).extracting(ToolDefinition::getName)
                .containsExactly("addTaskToList", "listCurrentTasks", "brokenTool", "sleepyTool", "pairedTool");
    }

    @Test
    void process_toolLoopNeverEnds_stopsAtRoundLimitAndCommitsNothing() {
        cloud.script(BackendOutcome.toolCalls(List.of(call("c1", "listCurrentTasks", "{}"))));

        TurnResult result = orchestrator(2).process("loop forever");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.RECURSION_LIMIT_EXCEEDED);
        assertThat(result.getToolRounds()).isEqualTo(2);
        assertThat(result.getBackendAttempts()).isEqualTo(3);
        assertThat(onDevice.windows).isEmpty();
        assertThat(store.fullHistory()).hasSize(1);
        assertThat(listener.changed).isEmpty();
        assertThat(listener.finished).containsExactly(result);
    }

    @Test
    void process_everyTierFails_exhaustsLadderOncePerTier() {
        cloud.script(BackendOutcome.failure(ErrorKind.BACKEND_UNAVAILABLE, "down"));
        onDevice.script(BackendOutcome.failure(ErrorKind.MALFORMED_RESPONSE, "garbage"));

        TurnResult result = orchestrator(5).process("hello");

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.ALL_TIERS_EXHAUSTED);
        assertThat(result.getBackendAttempts()).isEqualTo(4);
        assertThat(result.getTier()).isEqualTo("text-only");
        assertThat(cloud.windows).hasSize(1);
        assertThat(onDevice.windows).hasSize(3);
        assertThat(onDevice.tools.get(1)).extracting(ToolDefinition::getName).containsExactly("listCurrentTasks");
        assertThat(onDevice.tools.get(2)).isEmpty();
        assertThat(store.fullHistory()).hasSize(1);
        assertThat(result.userFacingText()).isEqualTo(ErrorKind.ALL_TIERS_EXHAUSTED.userMessage());
    }

    @Test
    void process_cloudTimesOut_onDeviceAnswersSameHistory() {
        cloud.script(BackendOutcome.failure(ErrorKind.TIMEOUT, "slow"));
        onDevice.script(BackendOutcome.text("Here is a small first step."));

        TurnResult result = orchestrator(5).process("help me start");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTier()).isEqualTo("on-device-full");
        assertThat(result.getBackendAttempts()).isEqualTo(2);
        assertThat(onDevice.windows.get(0)).isEqualTo(cloud.windows.get(0));
        assertThat(store.fullHistory()).hasSize(3);
    }

    @Test
    void process_cloudTimesOutTwice_retriedThenOnDeviceAnswers() {
        cloud.script(BackendOutcome.failure(ErrorKind.TIMEOUT, "slow"));
        onDevice.script(BackendOutcome.text("Local answer."));
        FocusProperties.Backend props = new FocusProperties.Backend();
        props.getRetry().setMaxAttempts(2);
        props.getRetry().setWaitMs(10);
        props.getRetry().setRetryOn(List.of(ErrorKind.TIMEOUT));
        props.getCircuitBreaker().setEnabled(false);
        BackendAdapter resilientCloud = ResilientBackendAdapter.wrap(
                cloud, props, RetryRegistry.ofDefaults(), CircuitBreakerRegistry.ofDefaults());

        TurnResult result = orchestratorBuilder(5)
                .backends(Map.of("cloud", resilientCloud, "on-device", onDevice))
                .build()
                .process("plan my afternoon");

        assertThat(result.getFinalText()).isEqualTo("Local answer.");
        assertThat(result.getTier()).isEqualTo("on-device-full");
        assertThat(result.getBackendAttempts()).isEqualTo(2);
        assertThat(cloud.windows).hasSize(2);
        assertThat(onDevice.windows).hasSize(1);
    }

    @Test
    void process_failureAfterToolRound_rollsBackEverything() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(call("c1", "addTaskToList", "{\"taskDescription\":\"Buy milk\"}"))),
                BackendOutcome.failure(ErrorKind.BACKEND_UNAVAILABLE, "down"));
        onDevice.script(BackendOutcome.failure(ErrorKind.BACKEND_UNAVAILABLE, "down"));

        TurnResult result = orchestrator(5).process("add buy milk");

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.ALL_TIERS_EXHAUSTED);
        assertThat(store.fullHistory()).containsExactly(Message.system(SYSTEM_PROMPT));
        // the degraded tier resends the staged tool round
        assertThat(onDevice.windows.get(0)).hasSize(4);
    }

    @Test
    void process_toolErrorsBecomeToolMessages() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(
                        call("c1", "brokenTool", "{}"),
                        call("c2", "fooBar", "{}"))),
                BackendOutcome.text("Something went wrong saving that."));

        TurnResult result = orchestrator(5).process("do it");

        assertThat(result.isSuccess()).isTrue();
        List<Message> history = store.fullHistory();
        assertThat(history.get(3).getContent()).isEqualTo("brokenTool failed: disk full");
        assertThat(history.get(4).getContent()).isEqualTo("unknown tool: fooBar");
    }

    @Test
    void process_concurrentToolsKeepRequestOrder() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(
                        call("c1", "pairedTool", "first"),
                        call("c2", "pairedTool", "second"))),
                BackendOutcome.text("Both done."));

        orchestrator(5).process("run both");

        List<Message> history = store.fullHistory();
        assertThat(history.get(3).getToolCallId()).isEqualTo("c1");
        assertThat(history.get(3).getContent()).isEqualTo("ran with partner first");
        assertThat(history.get(4).getToolCallId()).isEqualTo("c2");
        assertThat(history.get(4).getContent()).isEqualTo("ran with partner second");
    }

    @Test
    void process_slowTool_timesOutAndTurnContinues() {
        cloud.script(
                BackendOutcome.toolCalls(List.of(call("c1", "sleepyTool", "{}"))),
                BackendOutcome.text("That took too long, try again later."));

        long start = System.currentTimeMillis();
        TurnResult result = orchestratorBuilder(5).toolTimeoutMs(200).build().process("nap");

        assertThat(result.isSuccess()).isTrue();
        assertThat(System.currentTimeMillis() - start).isLessThan(3_000);
        assertThat(store.fullHistory().get(3).getContent()).isEqualTo("sleepyTool timed out");
    }

    @Test
    void process_toolNotOfferedByTier_isRefused() {
        cloud.script(BackendOutcome.failure(ErrorKind.TIMEOUT, "slow"));
        onDevice.script(
                BackendOutcome.failure(ErrorKind.CONTENT_FILTERED, "refused"),
                BackendOutcome.toolCalls(List.of(call("c1", "addTaskToList", "{\"taskDescription\":\"x\"}"))),
                BackendOutcome.text("I can only list tasks right now."));

        TurnResult result = orchestrator(5).process("add x");

        assertThat(result.getTier()).isEqualTo("on-device-minimal");
        assertThat(addedTasks).isEmpty();
        assertThat(store.fullHistory().get(3).getContent()).isEqualTo("tool not available right now: addTaskToList");
    }

    @Test
    void process_ladderStartsAtTopEveryTurn() {
        cloud.script(
                BackendOutcome.failure(ErrorKind.TIMEOUT, "slow"),
                BackendOutcome.text("Back online."));
        onDevice.script(BackendOutcome.text("Local answer."));
        ConversationOrchestrator orchestrator = orchestrator(5);

        TurnResult first = orchestrator.process("one");
        TurnResult second = orchestrator.process("two");

        assertThat(first.getTier()).isEqualTo("on-device-full");
        assertThat(second.getTier()).isEqualTo("cloud-full");
        assertThat(second.getBackendAttempts()).isEqualTo(1);
        assertThat(store.fullHistory()).hasSize(5);
    }

    @Test
    void cancel_duringBackendCall_commitsNothing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        cloud.script(() -> {
            entered.countDown();
            sleepQuietly(10_000);
            return Thread.currentThread().isInterrupted()
                    ? BackendOutcome.failure(ErrorKind.CANCELLED, "interrupted")
                    : BackendOutcome.text("too late");
        });
        ConversationOrchestrator orchestrator = orchestratorBuilder(5)
                .turnExecutor(new SimpleAsyncTaskExecutor("test-turn-"))
                .build();

        TurnHandle handle = orchestrator.submit("long request");
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.cancel()).isTrue();
        TurnResult result = handle.result().get(2, TimeUnit.SECONDS);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(store.fullHistory()).hasSize(1);
        assertThat(orchestrator.isBusy()).isFalse();
        assertThat(handle.cancel()).isFalse();
    }

    @Test
    void process_callerInterruptedDuringTurn_keepsInterruptFlag() {
        cloud.script(() -> {
            Thread.currentThread().interrupt();
            return BackendOutcome.text("Done.");
        });

        TurnResult result = orchestrator(5).process("hi");

        assertThat(result.isSuccess()).isTrue();
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void process_cancelledFromAnotherThread_leavesCallerFlagClear() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        cloud.script(() -> {
            entered.countDown();
            sleepQuietly(10_000);
            return Thread.currentThread().isInterrupted()
                    ? BackendOutcome.failure(ErrorKind.CANCELLED, "interrupted")
                    : BackendOutcome.text("too late");
        });
        ConversationOrchestrator orchestrator = orchestrator(5);
        AtomicReference<TurnResult> result = new AtomicReference<>();
        AtomicBoolean flagAfterTurn = new AtomicBoolean(true);

        Thread caller = new Thread(() -> {
            result.set(orchestrator.process("long request"));
            flagAfterTurn.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.cancel()).isTrue();
        caller.join(2_000);

        assertThat(result.get().getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(flagAfterTurn.get()).isFalse();
    }

    @Test
    void submit_whileTurnInFlight_isRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        cloud.script(() -> {
            entered.countDown();
            awaitQuietly(release);
            return BackendOutcome.text("first answer");
        });
        ConversationOrchestrator orchestrator = orchestratorBuilder(5)
                .turnExecutor(new SimpleAsyncTaskExecutor("test-turn-"))
                .build();

        TurnHandle handle = orchestrator.submit("first");
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> orchestrator.submit("second")).isInstanceOf(TurnInProgressException.class);
        assertThatThrownBy(orchestrator::reset).isInstanceOf(TurnInProgressException.class);

        release.countDown();
        assertThat(handle.result().get(2, TimeUnit.SECONDS).getFinalText()).isEqualTo("first answer");
        assertThat(store.fullHistory()).extracting(Message::getContent)
                .containsExactly(SYSTEM_PROMPT, "first", "first answer");
    }

    @Test
    void process_listenerFailure_doesNotChangeResult() {
        cloud.script(BackendOutcome.text("ok"));
        ConversationOrchestrator orchestrator = orchestratorBuilder(5)
                .listener(new TurnListener() {
                    @Override
                    public void conversationChanged(String sessionId, List<Message> history) {
                        throw new IllegalStateException("redis down");
                    }
                })
                .build();

        TurnResult result = orchestrator.process("hi");

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.fullHistory()).hasSize(3);
    }

    @Test
    void reset_clearsToSystemAndNotifies() {
        cloud.script(BackendOutcome.text("ok"));
        ConversationOrchestrator orchestrator = orchestrator(5);
        orchestrator.process("hi");

        orchestrator.reset();

        assertThat(orchestrator.history()).containsExactly(Message.system(SYSTEM_PROMPT));
        assertThat(listener.resets).isEqualTo(1);
    }

    private ConversationOrchestrator orchestrator(int maxToolRounds) {
        return orchestratorBuilder(maxToolRounds).build();
    }

    private ConversationOrchestrator.ConversationOrchestratorBuilder orchestratorBuilder(int maxToolRounds) {
        Set<String> all = registry.toolNames();
        DegradationLadder ladder = DegradationLadder.of(List.of(
                new CapabilityTier("cloud-full", "cloud", all),
                new CapabilityTier("on-device-full", "on-device", all),
                new CapabilityTier("on-device-minimal", "on-device", Set.of("listCurrentTasks")),
                new CapabilityTier("text-only", "on-device", Set.of())),
                Set.of("cloud", "on-device"), all);

        return ConversationOrchestrator.builder()
                .sessionId("session-1")
                .store(store)
                .toolRegistry(registry)
                .backends(Map.of("cloud", cloud, "on-device", onDevice))
                .ladder(ladder)
                .maxToolRounds(maxToolRounds)
                .toolTimeoutMs(5_000)
                .turnExecutor(Runnable::run)
                .toolExecutor(new SimpleAsyncTaskExecutor("test-tool-"))
                .listener(listener);
    }

    private static ToolCall call(String id, String name, String args) {
        return ToolCall.builder().id(id).toolName(name).argumentsJson(args).build();
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Replays scripted replies; the last one repeats. */
    private static class FakeBackend implements BackendAdapter {

        private final String id;
        private final Deque<Supplier<BackendOutcome>> script = new ArrayDeque<>();
        private Supplier<BackendOutcome> last;
        final List<List<Message>> windows = new ArrayList<>();
        final List<List<ToolDefinition>> tools = new ArrayList<>();

        FakeBackend(String id) {
            this.id = id;
        }

        void script(BackendOutcome... outcomes) {
            for (BackendOutcome outcome : outcomes) {
                script.add(() -> outcome);
            }
        }

        void script(Supplier<BackendOutcome> behaviour) {
            script.add(behaviour);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public BackendOutcome send(List<Message> window, List<ToolDefinition> offered) {
            windows.add(List.copyOf(window));
            tools.add(List.copyOf(offered));
            if (!script.isEmpty()) {
                last = script.poll();
            }
            return last.get();
        }
    }

    private record FakeTool(String name, Function<String, ToolResult> behaviour) implements AgentTool {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return name;
        }

        @Override
        public Map<String, Object> getInputSchema() {
            return Map.of("type", "object", "properties", Map.of());
        }

        @Override
        public ToolResult execute(String argumentsJson) {
            return behaviour.apply(argumentsJson);
        }
    }

    private static class RecordingListener implements TurnListener {

        final List<List<Message>> changed = new CopyOnWriteArrayList<>();
        final List<TurnResult> finished = new CopyOnWriteArrayList<>();
        int resets;

        @Override
        public void conversationChanged(String sessionId, List<Message> history) {
            changed.add(history);
        }

        @Override
        public void conversationReset(String sessionId) {
            resets++;
        }

        @Override
        public void turnFinished(TurnContext context, TurnResult result) {
            finished.add(result);
        }
    }
}
