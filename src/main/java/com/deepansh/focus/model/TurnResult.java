package com.deepansh.focus.model;

import lombok.Builder;
import lombok.Value;

/**
 * Terminal outcome of one user turn.
 */
@Value
@Builder
public class TurnResult {

    boolean success;
    String finalText;
    ErrorKind errorKind;

    /** Label of the tier that produced the result, or the last tier tried. */
    String tier;
    int backendAttempts;
    int toolRounds;

    public static TurnResult success(String finalText, String tier, int backendAttempts, int toolRounds) {
        return TurnResult.builder()
                .success(true)
                .finalText(finalText)
                .tier(tier)
                .backendAttempts(backendAttempts)
                .toolRounds(toolRounds)
                .build();
    }

    public static TurnResult failure(ErrorKind kind, String tier, int backendAttempts, int toolRounds) {
        return TurnResult.builder()
                .success(false)
                .errorKind(kind)
                .tier(tier)
                .backendAttempts(backendAttempts)
                .toolRounds(toolRounds)
                .build();
    }

    /** Text shown to the user: the answer, or a single legible failure line. */
    public String userFacingText() {
        return success ? finalText : errorKind.userMessage();
    }
}
