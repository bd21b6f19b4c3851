package com.purchasingpower.bookflow.api;

import com.purchasingpower.bookflow.orchestrator.OrchestratorResult;
import com.purchasingpower.bookflow.orchestrator.QueryOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the bookstore assistant.
 *
 * POST /api/v1/chat answers one message synchronously.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    static final long ANONYMOUS_USER = 1L;

    private final QueryOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest()
                .body(ChatResponse.error("Message is required"));
        }

        Long userId = request.getUserId() != null ? request.getUserId() : ANONYMOUS_USER;
        try {
            OrchestratorResult result = orchestrator.handle(request.getMessage().trim(), userId, request.getSessionId());
            return ResponseEntity.ok(ChatResponse.from(result));
        } catch (Exception e) {
            log.error("Chat request failed for user {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ChatResponse.error(e.getMessage()));
        }
    }
}
