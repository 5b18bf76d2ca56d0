package com.deepansh.focus.config;

import com.deepansh.focus.model.ErrorKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the assistant.
 * Bound from application.yml under the "focus" prefix.
 */
@Component
@ConfigurationProperties(prefix = "focus")
@Data
public class FocusProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Conversation conversation = new Conversation();
    private Backends backends = new Backends();

    /** Ordered capability tiers, best first. The last one must be text-only. */
    private List<Tier> ladder = new ArrayList<>();

    private Calendar calendar = new Calendar();
    private Health health = new Health();

    @Data
    public static class Orchestrator {
        /** Tool rounds allowed in one turn before it fails as a runaway loop. */
        private int maxToolRounds = 5;
        /** Upper bound for one batch of concurrent tool executions. */
        private long toolTimeoutMs = 30_000;
    }

    @Data
    public static class Conversation {
        private int maxRecent = 20;
        /** Idle sessions are dropped from memory after this long and reloaded from Redis on next use. */
        private long sessionIdleTimeoutMs = 1_800_000;
        private String systemPrompt = """
                You are a focused, upbeat assistant inside an ADHD-friendly task manager.
                Help the user capture, prioritise and break down tasks, and plan today's calendar.

                Rules:
                - Use the task tools to change the to-do list; never pretend a change happened.
                - Refer to tasks by their exact description as returned by listCurrentTasks.
                - Calendar tools only work with events for today.
                - If a tool returns an error, explain it briefly instead of calling it again.
                - Keep replies short and actionable.
                """;
    }

    @Data
    public static class Backends {
        private Backend cloud = new Backend();
        private Backend onDevice = new Backend();
    }

    @Data
    public static class Backend {
        private String baseUrl;
        private String apiKey = "";
        private String model;
        private int maxTokens = 1024;
        private double temperature = 0.3;
        /** Deadline for an ordinary request. */
        private long timeoutMs = 30_000;
        /** Deadline for complex requests and reasoning models. */
        private long complexTimeoutMs = 300_000;
        /** Models that always get the complex deadline. */
        private List<String> reasoningModels = new ArrayList<>();
        /** When non-empty, tools outside this list are never offered to this backend. */
        private List<String> allowedTools = new ArrayList<>();
        private Retry retry = new Retry();
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 1;
        private long waitMs = 1_000;
        private List<ErrorKind> retryOn = new ArrayList<>();
    }

    @Data
    public static class CircuitBreaker {
        private boolean enabled = true;
        private float failureRateThreshold = 50;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 5;
        private long openStateWaitMs = 30_000;
    }

    @Data
    public static class Tier {
        private String label;
        /** Backend id: "cloud" or "on-device". */
        private String backend;
        /** Tool names; ["*"] means every registered tool, empty means text only. */
        private List<String> tools = new ArrayList<>();
    }

    @Data
    public static class Calendar {
        private String baseUrl = "https://www.googleapis.com/calendar/v3";
        private String calendarId = "primary";
        private String accessToken = "";
        /** Zone used to interpret "today" and times like "9:00 AM". Empty means system default. */
        private String zoneId = "";
    }

    @Data
    public static class Health {
        private boolean enabled = false;
    }
}
