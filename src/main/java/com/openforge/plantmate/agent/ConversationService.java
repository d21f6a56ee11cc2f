package com.openforge.plantmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.domain.ChatMessage;
import com.openforge.plantmate.domain.ChatSession;
import com.openforge.plantmate.llm.model.Message;
import com.openforge.plantmate.llm.model.ToolCall;
import com.openforge.plantmate.repository.ChatMessageRepository;
import com.openforge.plantmate.repository.ChatSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists the messages of a session in order and rebuilds the context window
 * sent to the model from them.
 *
 * Responsibilities:
 *   - append user / tool / assistant messages with a per-session sequence number
 *   - create the session row the first time an unknown id is seen
 *   - rebuild the model context: system prompt + history, tool messages replayed
 *     as an assistant tool call followed by its result
 *   - trim the context to a sliding window without orphaning a tool result
 *
 * A session runs at most one turn at a time, so sequence numbers are assigned
 * without further locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final int TITLE_LENGTH = 80;

    private final ChatSessionRepository  sessionRepository;
    private final ChatMessageRepository  messageRepository;
    private final OrchestratorProperties properties;
    private final ObjectMapper           objectMapper;

    // ── Append ───────────────────────────────────────────────────────────────

    @Transactional
    public ChatMessage appendUser(String sessionId, String content) {
        ChatSession session = touch(sessionId);
        if (session.getTitle() == null || session.getTitle().isBlank()) {
            session.setTitle(content.strip().substring(0, Math.min(TITLE_LENGTH, content.strip().length())));
        }
        return save(ChatMessage.builder()
                .sessionId(sessionId)
                .role(ChatMessage.Role.USER)
                .content(content));
    }

    @Transactional
    public ChatMessage appendTool(String sessionId, ToolInvocation invocation, String toolCallId) {
        touch(sessionId);
        return save(ChatMessage.builder()
                .sessionId(sessionId)
                .role(ChatMessage.Role.TOOL)
                .content(invocation.summary())
                .toolName(invocation.toolName())
                .toolCallId(toolCallId)
                .toolInput(writeJson(invocation))
                .toolResult(invocation.resultJson()));
    }

    @Transactional
    public ChatMessage appendAssistant(String sessionId, String content) {
        touch(sessionId);
        return save(ChatMessage.builder()
                .sessionId(sessionId)
                .role(ChatMessage.Role.ASSISTANT)
                .content(content == null ? "" : content));
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public Optional<ChatSession> findSession(String sessionId) {
        return sessionRepository.findBySessionId(sessionId);
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> history(String sessionId) {
        return messageRepository.findBySessionIdOrderBySequenceNoAsc(sessionId);
    }

    /**
     * System prompt followed by the session's history (including the user
     * message of the current turn), trimmed to the configured window.
     */
    @Transactional(readOnly = true)
    public List<Message> buildContext(String sessionId) {
        List<Message> history = new ArrayList<>();
        for (ChatMessage m : history(sessionId)) {
            switch (m.getRole()) {
                case USER      -> history.add(Message.user(m.getContent()));
                case ASSISTANT -> history.add(Message.assistantText(m.getContent()));
                case TOOL      -> {
                    String callId = m.getToolCallId() != null ? m.getToolCallId() : "call_" + m.getMessageId();
                    String args   = m.getToolInput() != null ? m.getToolInput() : "{}";
                    String result = m.getToolResult() != null ? m.getToolResult() : String.valueOf(m.getContent());
                    history.add(Message.assistantToolCall(ToolCall.of(callId, m.getToolName(), args)));
                    history.add(Message.toolResult(callId, result));
                }
            }
        }

        List<Message> context = new ArrayList<>(history.size() + 1);
        context.add(Message.system(properties.systemPrompt()));
        context.addAll(trim(history, properties.maxContextMessages() - 1));
        return context;
    }

    /**
     * Keeps the most recent {@code limit} messages. The window never opens on a
     * tool result whose tool call was cut off.
     */
    static List<Message> trim(List<Message> history, int limit) {
        if (history.size() <= limit) {
            return history;
        }
        int from = history.size() - limit;
        while (from < history.size() && history.get(from).isToolResult()) {
            from++;
        }
        log.debug("[Context] Trimmed history from {} to {} messages", history.size(), history.size() - from);
        return new ArrayList<>(history.subList(from, history.size()));
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private ChatSession touch(String sessionId) {
        ChatSession session = sessionRepository.findBySessionId(sessionId)
                .orElseGet(() -> {
                    log.info("[Conversation:{}] New session", sessionId);
                    return ChatSession.builder().sessionId(sessionId).build();
                });
        session.setLastActivityTime(LocalDateTime.now());
        return sessionRepository.save(session);
    }

    private ChatMessage save(ChatMessage.ChatMessageBuilder builder) {
        ChatMessage message = builder.build();
        message.setMessageId(UUID.randomUUID().toString());
        message.setSequenceNo(messageRepository.findMaxSequenceNo(message.getSessionId()) + 1);
        return messageRepository.save(message);
    }

    private String writeJson(ToolInvocation invocation) {
        try {
            return objectMapper.writeValueAsString(invocation.input());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize input of " + invocation.toolName(), e);
        }
    }
}
