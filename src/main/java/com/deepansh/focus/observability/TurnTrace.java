package com.deepansh.focus.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Record of one finished turn.
 *
 * Collection: focus_turn_traces
 *
 * Captures:
 * - Input and answer (or the error kind)
 * - Every tier attempted, in order, with its outcome
 * - Tool calls with latency and a result preview
 * - Token usage and total latency
 */
@Document(collection = "focus_turn_traces")
@CompoundIndexes({
    @CompoundIndex(name = "idx_session_date", def = "{'sessionId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "idx_status_date", def = "{'status': 1, 'createdAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnTrace {

    public enum Status { SUCCESS, FAILED, CANCELLED }

    @Id
    private String id;

    private String sessionId;
    private String userInput;
    private String finalAnswer;
    private Status status;

    /** Error kind name when status is not SUCCESS. */
    private String errorKind;

    private String finalTier;
    private int backendAttempts;
    private int toolRounds;
    private long totalLatencyMs;

    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    private List<Attempt> attempts;
    private List<ToolInvocation> toolCalls;

    @CreatedDate
    private Instant createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attempt {
        private String tier;
        private String outcome;
        private String failure;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolInvocation {
        private String toolName;
        private long latencyMs;
        private boolean success;
        private String resultPreview;
    }
}
