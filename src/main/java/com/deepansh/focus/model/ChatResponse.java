package com.deepansh.focus.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String sessionId;
    private boolean success;
    private String reply;
    private ErrorKind errorKind;
    private String tier;
    private int backendAttempts;
    private int toolRounds;

    public static ChatResponse from(String sessionId, TurnResult result) {
        return ChatResponse.builder()
                .sessionId(sessionId)
                .success(result.isSuccess())
                .reply(result.userFacingText())
                .errorKind(result.getErrorKind())
                .tier(result.getTier())
                .backendAttempts(result.getBackendAttempts())
                .toolRounds(result.getToolRounds())
                .build();
    }
}
