package com.deepansh.focus.api;

import com.deepansh.focus.core.ChatSessionService;
import com.deepansh.focus.model.ChatRequest;
import com.deepansh.focus.model.ChatResponse;
import com.deepansh.focus.model.Message;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Chat endpoints.
 *
 * POST   /api/v1/chat                         run one user message (new session if no sessionId)
 * POST   /api/v1/chat/{sessionId}/cancel      cancel the message in flight
 * GET    /api/v1/chat/{sessionId}/history     full, untruncated history
 * DELETE /api/v1/chat/{sessionId}/history     clear back to the system prompt
 * GET    /api/v1/chat/health
 *
 * A failed turn is still a 200: the body carries success=false, the error kind and a
 * readable reply. 409 means the session is busy with another message.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatSessionService chatSessionService;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [sessionId={}, inputLength={}]", request.getSessionId(), request.getInput().length());
        ChatSessionService.SessionTurn turn = chatSessionService.chat(request.getSessionId(), request.getInput());
        return ResponseEntity.ok(ChatResponse.from(turn.sessionId(), turn.result()));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
        boolean cancelled = chatSessionService.cancel(sessionId);
        log.info("Cancel request [sessionId={}, cancelled={}]", sessionId, cancelled);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<List<Message>> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(chatSessionService.history(sessionId));
    }

    @DeleteMapping("/{sessionId}/history")
    public ResponseEntity<Void> reset(@PathVariable String sessionId) {
        chatSessionService.reset(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
