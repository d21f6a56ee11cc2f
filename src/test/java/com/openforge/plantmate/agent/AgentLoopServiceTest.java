package com.openforge.plantmate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.agent.ToolInvocation.FailureKind;
import com.openforge.plantmate.agent.ToolInvocation.Outcome;
import com.openforge.plantmate.domain.ChatMessage;
import com.openforge.plantmate.gpu.GpuProperties;
import com.openforge.plantmate.gpu.GpuResidencyScheduler;
import com.openforge.plantmate.gpu.ModelClass;
import com.openforge.plantmate.gpu.ResidencyUnavailableException;
import com.openforge.plantmate.llm.LlmClient;
import com.openforge.plantmate.llm.LlmRouter;
import com.openforge.plantmate.llm.model.ChatRequest;
import com.openforge.plantmate.llm.model.ChatResponse;
import com.openforge.plantmate.llm.model.Message;
import com.openforge.plantmate.llm.model.ToolCall;
import com.openforge.plantmate.stream.EventType;
import com.openforge.plantmate.stream.StreamEvent;
import com.openforge.plantmate.stream.TurnStream;
import com.openforge.plantmate.tool.ToolName;
import com.openforge.plantmate.tool.ToolRegistry;
import com.openforge.plantmate.tool.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentLoopServiceTest {

    private static final String SESSION = "s-42";

    private final ObjectMapper          objectMapper = new ObjectMapper();
    private final LlmRouter             llmRouter    = mock(LlmRouter.class);
    private final ConversationService   conversation = mock(ConversationService.class);
    private final ToolRegistry          registry     = mock(ToolRegistry.class);
    private final ToolDispatcher        dispatcher   = mock(ToolDispatcher.class);
    private final GpuResidencyScheduler scheduler    = mock(GpuResidencyScheduler.class);

    private final ToolSpec inventory = spec(ToolName.INVENTORY_SQL, ModelClass.LLM);
    private final ToolSpec graph     = spec(ToolName.GRAPH_SEARCH, ModelClass.LLM);

    private AgentLoopService service;
    private TurnStream       stream;

    @BeforeEach
    void setUp() {
        service = newService(5, false);
        stream  = new TurnStream(SESSION, 256, Duration.ofSeconds(1));

        when(conversation.buildContext(SESSION)).thenAnswer(inv -> new ArrayList<>(List.of(
                Message.system("prompt"), Message.user("question"))));
        when(conversation.appendAssistant(eq(SESSION), anyString()))
                .thenReturn(ChatMessage.builder().messageId("msg-1").build());
        when(registry.definitions()).thenReturn(List.of());
        when(registry.lookup(ToolName.INVENTORY_SQL.wireName())).thenReturn(Optional.of(inventory));
        when(registry.lookup(ToolName.GRAPH_SEARCH.wireName())).thenReturn(Optional.of(graph));
    }

    @Test
    void directAnswer_streamsTokensAndDone() {
        when(llmRouter.chat(any())).thenReturn(text("no tools needed"));

        LoopPhase phase = service.runTurn(SESSION, "Hi", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(events.get(0).type()).isEqualTo(EventType.STATUS);
        assertThat(events).noneMatch(e -> e.type() == EventType.TOOL_START);
        assertThat(joinedTokens(events)).isEqualTo("no tools needed");
        assertThat(events).filteredOn(e -> e.type() == EventType.TOKEN)
                .allMatch(e -> e.content().codePointCount(0, e.content().length()) <= 8);
        assertThat(last(events)).isEqualTo(StreamEvent.done("msg-1"));
        verify(conversation).appendUser(SESSION, "Hi");
        verify(conversation).appendAssistant(SESSION, "no tools needed");
        verify(dispatcher, never()).invoke(any(), any());
    }

    @Test
    void singleToolCall_emitsToolEventsThenAnswer() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall("call_1", "inventory_sql_search", "{\"question\":\"PA6 stock\"}"),
                text("There are 250 kg of PA6 in stock."));
        ToolInvocation ok = invocation("inventory_sql_search", Outcome.SUCCESS, null,
                "{\"answer\":\"250 kg\"}", "Retrieved 1 row(s) from the warehouse: 250 kg PA6");
        when(dispatcher.invoke(eq(inventory), any())).thenReturn(ok);

        LoopPhase phase = service.runTurn(SESSION, "How much PA6 is in stock?", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(types(events)).containsSubsequence(
                EventType.STATUS, EventType.TOOL_START, EventType.TOOL_DONE, EventType.STATUS,
                EventType.TOKEN, EventType.DONE);
        StreamEvent start = first(events, EventType.TOOL_START);
        assertThat(start.tool()).isEqualTo("inventory_sql_search");
        assertThat(start.input().path("question").asText()).isEqualTo("PA6 stock");
        assertThat(first(events, EventType.TOOL_DONE).summary()).contains("250 kg");
        assertThat(joinedTokens(events)).isEqualTo("There are 250 kg of PA6 in stock.");
        verify(conversation).appendTool(SESSION, ok, "call_1");

        // the second decision sees the tool call and its result
        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter, times(2)).chat(requests.capture());
        List<Message> second = requests.getAllValues().get(1).messages();
        assertThat(second.get(second.size() - 2).toolCalls()).hasSize(1);
        assertThat(second.get(second.size() - 1).toolCallId()).isEqualTo("call_1");
    }

    @Test
    void iterationBound_forcesSynthesisWithoutTools() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "enterprise_graph_search", "{\"question\":\"a\"}"),
                toolCall("c2", "enterprise_graph_search", "{\"question\":\"b\"}"),
                toolCall("c3", "enterprise_graph_search", "{\"question\":\"c\"}"),
                toolCall("c4", "enterprise_graph_search", "{\"question\":\"d\"}"),
                toolCall("c5", "enterprise_graph_search", "{\"question\":\"e\"}"),
                toolCall("c6", "enterprise_graph_search", "{\"question\":\"f\"}"));
        when(dispatcher.invoke(eq(graph), any())).thenReturn(invocation("enterprise_graph_search",
                Outcome.SUCCESS, null, "{\"records_count\":2}", "Found 2 records in the production graph"));
        doAnswer(inv -> {
            Consumer<String> tokens = inv.getArgument(1);
            tokens.accept("Based on ");
            tokens.accept("the graph.");
            return text("Based on the graph.");
        }).when(llmRouter).streamChat(any(), any());

        LoopPhase phase = service.runTurn(SESSION, "Route of part X?", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(events).filteredOn(e -> e.type() == EventType.TOOL_START).hasSize(5);
        assertThat(joinedTokens(events)).isEqualTo("Based on the graph.");
        assertThat(last(events).type()).isEqualTo(EventType.DONE);
        verify(dispatcher, times(5)).invoke(eq(graph), any());
        verify(llmRouter, times(6)).chat(any());

        ArgumentCaptor<ChatRequest> synthesis = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter).streamChat(synthesis.capture(), any());
        assertThat(synthesis.getValue().tools()).isNull();
        assertThat(last(synthesis.getValue().messages()).content())
                .isEqualTo(AgentLoopService.FINALIZE_INSTRUCTION);
    }

    @Test
    void emptySynthesis_fallsBackToFixedSentence() {
        service = newService(1, false);
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "enterprise_graph_search", "{}"),
                toolCall("c2", "enterprise_graph_search", "{}"));
        when(dispatcher.invoke(eq(graph), any())).thenReturn(invocation("enterprise_graph_search",
                Outcome.SUCCESS, null, "{}", "Found 0 records in the production graph"));
        when(llmRouter.streamChat(any(), any())).thenReturn(text(""));

        service.runTurn(SESSION, "?", stream);

        assertThat(joinedTokens(drain())).isEqualTo(AgentLoopService.FALLBACK_ANSWER);
    }

    @Test
    void swapTimeout_answerSaysToolWasUnavailable() {
        ToolSpec blueprint = spec(ToolName.BLUEPRINT_VISION, ModelClass.VLM);
        when(registry.lookup("blueprint_vision")).thenReturn(Optional.of(blueprint));
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "blueprint_vision", "{\"image_path\":\"/uploads/d.png\"}"),
                text("The drawing could not be analysed right now."));
        when(dispatcher.invoke(eq(blueprint), any())).thenReturn(invocation("blueprint_vision",
                Outcome.REJECTED, FailureKind.SWAP_TIMEOUT,
                "{\"error\":\"Swap to qwen3-vl:14b on slot gpu0 exceeded 90s\"}", "GPU model swap timed out"));

        LoopPhase phase = service.runTurn(SESSION, "Check drawing d.png", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(first(events, EventType.TOOL_DONE).summary()).isEqualTo("GPU model swap timed out");
        assertThat(joinedTokens(events)).contains("blueprint_vision could not get its model loaded in time");
        assertThat(last(events)).isEqualTo(StreamEvent.done("msg-1"));
        assertThat(events).noneMatch(e -> e.type() == EventType.ERROR);
    }

    @Test
    void toolTimeout_isReportedAndAnswerCarriesNote() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "enterprise_graph_search", "{\"question\":\"load\"}"),
                text("I could not reach the graph."));
        when(dispatcher.invoke(eq(graph), any())).thenReturn(invocation("enterprise_graph_search",
                Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT, "{\"error\":\"no answer within 60s\"}", "Tool timed out"));

        LoopPhase phase = service.runTurn(SESSION, "Machine load?", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(first(events, EventType.TOOL_DONE).summary()).isEqualTo("Tool timed out");
        assertThat(joinedTokens(events))
                .startsWith("I could not reach the graph.")
                .contains("enterprise_graph_search timed out");
        assertThat(last(events).type()).isEqualTo(EventType.DONE);
    }

    @Test
    void unknownTool_isRejectedAndLoopContinues() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "drop_tables", "{}"),
                text("Sorry."));
        when(registry.lookup("drop_tables")).thenReturn(Optional.empty());
        when(dispatcher.unknownTool(eq("drop_tables"), any())).thenReturn(invocation("drop_tables",
                Outcome.REJECTED, FailureKind.TOOL_REJECTED, "{\"error\":\"Unknown tool: drop_tables\"}",
                "Error: unknown tool"));

        LoopPhase phase = service.runTurn(SESSION, "?", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.DONE);
        assertThat(first(events, EventType.TOOL_DONE).summary()).isEqualTo("Error: unknown tool");
        verify(dispatcher, never()).invoke(any(), any());
    }

    @Test
    void missingToolCallId_isGenerated() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall(null, "inventory_sql_search", "{}"),
                text("Done."));
        when(dispatcher.invoke(eq(inventory), any())).thenReturn(invocation("inventory_sql_search",
                Outcome.SUCCESS, null, "{}", "Retrieved 0 row(s) from the warehouse: "));

        service.runTurn(SESSION, "?", stream);

        ArgumentCaptor<String> callId = ArgumentCaptor.forClass(String.class);
        verify(conversation).appendTool(eq(SESSION), any(), callId.capture());
        assertThat(callId.getValue()).startsWith("call_").hasSize(17);
    }

    @Test
    void modelFailure_endsWithSingleErrorEvent() {
        when(llmRouter.chat(any())).thenThrow(new LlmClient.LlmException("primary provider ultimately failed"));

        LoopPhase phase = service.runTurn(SESSION, "?", stream);

        List<StreamEvent> events = drain();
        assertThat(phase).isEqualTo(LoopPhase.FAILED);
        assertThat(events).filteredOn(StreamEvent::isTerminal).hasSize(1);
        assertThat(last(events).type()).isEqualTo(EventType.ERROR);
        assertThat(last(events).detail()).doesNotContain("primary provider");
        verify(conversation, never()).appendAssistant(any(), any());
    }

    @Test
    void llmResidencyUnavailable_failsTurn() {
        service = newService(5, true);
        when(scheduler.acquire(eq(ModelClass.LLM), any(Duration.class)))
                .thenThrow(new ResidencyUnavailableException("Slot gpu0 busy for longer than 120s"));

        LoopPhase phase = service.runTurn(SESSION, "?", stream);

        assertThat(phase).isEqualTo(LoopPhase.FAILED);
        assertThat(last(drain()).type()).isEqualTo(EventType.ERROR);
        verify(llmRouter, never()).chat(any());
    }

    @Test
    void cancelledStream_stopsWithoutTerminalEvent() {
        when(llmRouter.chat(any())).thenReturn(
                toolCall("c1", "inventory_sql_search", "{}"),
                text("never sent"));
        when(dispatcher.invoke(eq(inventory), any())).thenAnswer(inv -> {
            stream.cancel();
            return invocation("inventory_sql_search", Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT,
                    "{\"error\":\"cancelled\"}", "Tool timed out");
        });

        LoopPhase phase = service.runTurn(SESSION, "?", stream);

        assertThat(phase).isEqualTo(LoopPhase.FAILED);
        assertThat(drain()).noneMatch(StreamEvent::isTerminal);
        verify(llmRouter, times(1)).chat(any());
        verify(conversation, never()).appendAssistant(any(), any());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private AgentLoopService newService(int maxIterations, boolean llmResident) {
        OrchestratorProperties properties =
                new OrchestratorProperties(maxIterations, 8, 50, Duration.ofSeconds(1), null);
        GpuProperties gpu = new GpuProperties(Duration.ofSeconds(1), llmResident, List.of());
        return new AgentLoopService(llmRouter, conversation, registry, dispatcher, scheduler,
                properties, gpu, objectMapper);
    }

    private static ToolSpec spec(ToolName name, ModelClass modelClass) {
        return new ToolSpec(name, URI.create("http://skills" + name.defaultEndpoint()), modelClass,
                Duration.ofSeconds(60), name.wireName(), null);
    }

    private ToolInvocation invocation(String tool, Outcome outcome, FailureKind kind, String result, String summary) {
        return new ToolInvocation(tool, objectMapper.createObjectNode(), Instant.now(), Duration.ofMillis(5),
                outcome, kind, result, summary);
    }

    private static ChatResponse text(String content) {
        return ChatResponse.ofMessage("r", "m", Message.assistantText(content), "stop");
    }

    private static ChatResponse toolCall(String id, String name, String arguments) {
        Message message = Message.builder()
                .role("assistant")
                .toolCalls(List.of(ToolCall.of(id, name, arguments)))
                .build();
        return ChatResponse.ofMessage("r", "m", message, "tool_calls");
    }

    private List<StreamEvent> drain() {
        List<StreamEvent> events = new ArrayList<>();
        try {
            StreamEvent event;
            while ((event = stream.poll(Duration.ZERO)) != null) {
                events.add(event);
            }
        } catch (InterruptedException e) {
            throw new AssertionError(e);
        }
        return events;
    }

    private static List<EventType> types(List<StreamEvent> events) {
        return events.stream().map(StreamEvent::type).toList();
    }

    private static String joinedTokens(List<StreamEvent> events) {
        StringBuilder text = new StringBuilder();
        events.stream().filter(e -> e.type() == EventType.TOKEN).forEach(e -> text.append(e.content()));
        return text.toString();
    }

    private static StreamEvent first(List<StreamEvent> events, EventType type) {
        return events.stream().filter(e -> e.type() == type).findFirst().orElseThrow();
    }

    private static <T> T last(List<T> items) {
        return items.get(items.size() - 1);
    }
}
