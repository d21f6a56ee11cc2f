package com.openforge.plantmate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.agent.ToolInvocation.Outcome;
import com.openforge.plantmate.domain.ChatMessage;
import com.openforge.plantmate.domain.ChatSession;
import com.openforge.plantmate.llm.model.Message;
import com.openforge.plantmate.repository.ChatMessageRepository;
import com.openforge.plantmate.repository.ChatSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationServiceTest {

    private static final String SESSION = "s-1";

    private final ObjectMapper          objectMapper = new ObjectMapper();
    private final ChatSessionRepository sessions     = mock(ChatSessionRepository.class);
    private final ChatMessageRepository messages     = mock(ChatMessageRepository.class);

    private ConversationService service;

    @BeforeEach
    void setUp() {
        service = service(50);
        when(sessions.save(any(ChatSession.class))).thenAnswer(inv -> inv.getArgument(0));
        when(messages.save(any(ChatMessage.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void firstMessageCreatesSessionWithTitle() {
        when(sessions.findBySessionId(SESSION)).thenReturn(Optional.empty());
        when(messages.findMaxSequenceNo(SESSION)).thenReturn(0);

        ChatMessage saved = service.appendUser(SESSION, "  What is the route of part 7-12?  ");

        ArgumentCaptor<ChatSession> session = ArgumentCaptor.forClass(ChatSession.class);
        verify(sessions).save(session.capture());
        assertThat(session.getValue().getSessionId()).isEqualTo(SESSION);
        assertThat(session.getValue().getTitle()).isEqualTo("What is the route of part 7-12?");
        assertThat(session.getValue().getLastActivityTime()).isNotNull();
        assertThat(saved.getSequenceNo()).isEqualTo(1);
        assertThat(saved.getMessageId()).hasSize(36);
        assertThat(saved.getRole()).isEqualTo(ChatMessage.Role.USER);
    }

    @Test
    void messagesContinueTheSequence() {
        when(sessions.findBySessionId(SESSION)).thenReturn(Optional.of(
                ChatSession.builder().sessionId(SESSION).title("existing").build()));
        when(messages.findMaxSequenceNo(SESSION)).thenReturn(4);
        ToolInvocation invocation = new ToolInvocation("inventory_sql_search",
                objectMapper.createObjectNode().put("question", "PA6"), Instant.now(), Duration.ofMillis(3),
                Outcome.SUCCESS, null, "{\"rows_count\":1}", "Retrieved 1 row(s) from the warehouse: ok");

        ChatMessage saved = service.appendTool(SESSION, invocation, "call_1");

        assertThat(saved.getSequenceNo()).isEqualTo(5);
        assertThat(saved.getRole()).isEqualTo(ChatMessage.Role.TOOL);
        assertThat(saved.getToolName()).isEqualTo("inventory_sql_search");
        assertThat(saved.getToolInput()).isEqualTo("{\"question\":\"PA6\"}");
        assertThat(saved.getToolResult()).isEqualTo("{\"rows_count\":1}");
        assertThat(saved.getContent()).startsWith("Retrieved 1 row(s)");
    }

    @Test
    void contextReplaysToolMessagesAsCallAndResult() {
        when(messages.findBySessionIdOrderBySequenceNoAsc(SESSION)).thenReturn(List.of(
                message(ChatMessage.Role.USER, "How much PA6?"),
                ChatMessage.builder().role(ChatMessage.Role.TOOL).messageId("m2")
                        .toolName("inventory_sql_search").toolCallId("call_9")
                        .toolInput("{\"question\":\"PA6\"}").toolResult("{\"rows_count\":1}")
                        .content("Retrieved 1 row(s)").build(),
                message(ChatMessage.Role.ASSISTANT, "250 kg."),
                message(ChatMessage.Role.USER, "And PA12?")));

        List<Message> context = service.buildContext(SESSION);

        assertThat(context).extracting(Message::role)
                .containsExactly("system", "user", "assistant", "tool", "assistant", "user");
        assertThat(context.get(0).content()).isEqualTo(OrchestratorProperties.DEFAULT_SYSTEM_PROMPT);
        assertThat(context.get(2).toolCalls().get(0).id()).isEqualTo("call_9");
        assertThat(context.get(2).toolCalls().get(0).function().name()).isEqualTo("inventory_sql_search");
        assertThat(context.get(3).toolCallId()).isEqualTo("call_9");
        assertThat(context.get(3).content()).isEqualTo("{\"rows_count\":1}");
        assertThat(context.get(5).content()).isEqualTo("And PA12?");
    }

    @Test
    void contextIsTrimmedToWindow() {
        service = service(4);
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(message(i % 2 == 0 ? ChatMessage.Role.USER : ChatMessage.Role.ASSISTANT, "m" + i));
        }
        when(messages.findBySessionIdOrderBySequenceNoAsc(SESSION)).thenReturn(history);

        List<Message> context = service.buildContext(SESSION);

        assertThat(context).hasSize(4);
        assertThat(context.get(0).role()).isEqualTo("system");
        assertThat(context).extracting(Message::content).endsWith("m7", "m8", "m9");
    }

    @Test
    void trimNeverOpensOnToolResult() {
        List<Message> history = List.of(
                Message.user("q"),
                Message.assistantText(""),
                Message.toolResult("c1", "{}"),
                Message.assistantText("answer"),
                Message.user("next"));

        List<Message> trimmed = ConversationService.trim(history, 3);

        assertThat(trimmed).extracting(Message::content).containsExactly("answer", "next");
    }

    @Test
    void shortHistoryIsUntouched() {
        List<Message> history = List.of(Message.user("q"), Message.assistantText("a"));

        assertThat(ConversationService.trim(history, 10)).isSameAs(history);
    }

    private ConversationService service(int maxContextMessages) {
        OrchestratorProperties properties =
                new OrchestratorProperties(5, 8, maxContextMessages, Duration.ofSeconds(1), null);
        return new ConversationService(sessions, messages, properties, objectMapper);
    }

    private static ChatMessage message(ChatMessage.Role role, String content) {
        return ChatMessage.builder().role(role).content(content).build();
    }
}
