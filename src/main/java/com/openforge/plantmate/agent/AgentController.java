package com.openforge.plantmate.agent;

import com.openforge.plantmate.agent.dto.MessageResponse;
import com.openforge.plantmate.agent.dto.SendMessageRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.List;

/**
 * Chat endpoints.
 *
 *   POST /sessions/{id}/message   run one turn; the response is the turn's event stream
 *   GET  /sessions/{id}/messages  persisted history of the session, in order
 *
 * The stream (text/event-stream) carries data frames:
 *   status, tool_start, tool_done, token …, then exactly one of done / error.
 */
@Slf4j
@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class AgentController {

    private final TurnLauncher        turnLauncher;
    private final ConversationService conversation;

    @PostMapping("/{sessionId}/message")
    public ResponseEntity<ResponseBodyEmitter> sendMessage(
            @PathVariable @Size(max = 64) String sessionId,
            @Valid @RequestBody SendMessageRequest request) {

        log.info("[Controller] Message for session {} ({} chars)", sessionId, request.content().length());
        return turnLauncher.start(sessionId, request.content());
    }

    @GetMapping("/{sessionId}/messages")
    public List<MessageResponse> messages(@PathVariable @Size(max = 64) String sessionId) {
        if (conversation.findSession(sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }
        return conversation.history(sessionId).stream()
                .map(MessageResponse::from)
                .toList();
    }
}
