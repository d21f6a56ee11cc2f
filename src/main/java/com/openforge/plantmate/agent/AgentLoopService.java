package com.openforge.plantmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.domain.ChatMessage;
import com.openforge.plantmate.gpu.GpuProperties;
import com.openforge.plantmate.gpu.GpuResidencyScheduler;
import com.openforge.plantmate.gpu.ModelClass;
import com.openforge.plantmate.gpu.Residency;
import com.openforge.plantmate.gpu.ResidencyUnavailableException;
import com.openforge.plantmate.llm.LlmClient;
import com.openforge.plantmate.llm.LlmRouter;
import com.openforge.plantmate.llm.model.ChatRequest;
import com.openforge.plantmate.llm.model.ChatResponse;
import com.openforge.plantmate.llm.model.Message;
import com.openforge.plantmate.llm.model.ToolDefinition;
import com.openforge.plantmate.llm.model.ToolCall;
import com.openforge.plantmate.stream.StreamEvent;
import com.openforge.plantmate.stream.TurnStream;
import com.openforge.plantmate.tool.ToolRegistry;
import com.openforge.plantmate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * One chat turn: the bounded, model-directed tool loop.
 *
 *   AWAITING_MODEL   status event; ask the model (tools attached) for the next step
 *     ├─ tool call, bound not reached → EXECUTING_TOOL
 *     ├─ tool call, bound reached     → FINALIZING (forced: answer without tools)
 *     └─ free text                    → FINALIZING
 *   EXECUTING_TOOL   tool_start; dispatch; tool_done; persist the tool message;
 *                    feed the result back → AWAITING_MODEL
 *   FINALIZING       answer streamed as token events, failure note appended,
 *                    assistant message persisted → DONE (done event)
 *   any error        → FAILED (error event unless the client is already gone)
 *
 * Tool failures never fail the turn: the model sees the failure object as the
 * tool result and the final answer names the tools that were unavailable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentLoopService {

    static final String FALLBACK_ANSWER =
            "The tool-call limit was reached before an answer could be formed. Please rephrase the question.";

    static final String FINALIZE_INSTRUCTION =
            "The tool-call limit for this question has been reached. Do not call any more tools. "
                    + "Answer the question now using only the information gathered above, "
                    + "and say plainly what could not be determined.";

    private final LlmRouter              llmRouter;
    private final ConversationService    conversation;
    private final ToolRegistry           registry;
    private final ToolDispatcher         dispatcher;
    private final GpuResidencyScheduler  scheduler;
    private final OrchestratorProperties properties;
    private final GpuProperties          gpuProperties;
    private final ObjectMapper           objectMapper;

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Runs the turn to completion on the calling thread. Exactly one terminal
     * event is published unless the stream was cancelled by the client.
     *
     * @return the phase the turn ended in, DONE or FAILED
     */
    public LoopPhase runTurn(String sessionId, String userContent, TurnStream stream) {
        LoopState state = new LoopState(sessionId, properties.maxIterations());
        log.info("[Agent:{}] Turn started: {}", sessionId,
                userContent.substring(0, Math.min(80, userContent.length())));
        try {
            conversation.appendUser(sessionId, userContent);
            List<Message> context = conversation.buildContext(sessionId);
            List<ToolDefinition> tools = registry.definitions();

            emit(stream, StreamEvent.status("Analysing the request..."));
            loop(state, context, tools, stream);

            appendFailureNote(state, stream);
            ChatMessage saved = conversation.appendAssistant(sessionId, state.answer());
            checkCancelled(stream);

            state.enter(LoopPhase.DONE);
            stream.publish(StreamEvent.done(saved.getMessageId()));
            log.info("[Agent:{}] Done after {} tool call(s), answer {} chars",
                    sessionId, state.iteration(), state.answer().length());

        } catch (TurnCancelledException e) {
            state.enter(LoopPhase.FAILED);
            log.info("[Agent:{}] Cancelled by client in iteration {}", sessionId, state.iteration());

        } catch (ModelUnavailableException e) {
            state.enter(LoopPhase.FAILED);
            log.error("[Agent:{}] Language model unavailable: {}", sessionId, e.getMessage());
            stream.publish(StreamEvent.error("The language model is currently unavailable. Please try again later."));

        } catch (RuntimeException e) {
            state.enter(LoopPhase.FAILED);
            if (stream.isCancelled()) {
                log.info("[Agent:{}] Cancelled by client ({})", sessionId, e.getMessage());
            } else {
                log.error("[Agent:{}] Unhandled exception in loop: {}", sessionId, e.getMessage(), e);
                stream.publish(StreamEvent.error("Internal error while processing the message."));
            }
        }
        return state.phase();
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    private void loop(LoopState state, List<Message> context, List<ToolDefinition> tools, TurnStream stream) {
        while (true) {
            checkCancelled(stream);

            ChatResponse response = callModel(stream,
                    () -> llmRouter.chat(ChatRequest.decision(context, tools)));

            if (!response.hasToolCalls()) {
                state.enter(LoopPhase.FINALIZING);
                String text = response.text();
                if (text.isBlank()) {
                    log.warn("[Agent:{}] Model returned an empty answer, asking for a synthesis", state.sessionId());
                    synthesize(state, context, stream);
                } else {
                    emitChunks(state, text, stream);
                }
                return;
            }

            List<ToolCall> calls = response.firstMessage().toolCalls();
            if (calls.size() > 1) {
                log.warn("[Agent:{}] Model requested {} tools at once; executing only {}",
                        state.sessionId(), calls.size(), calls.get(0).function().name());
            }

            if (state.iterationBoundReached()) {
                log.warn("[Agent:{}] Iteration bound ({}) reached, forcing final answer",
                        state.sessionId(), state.maxIterations());
                state.enter(LoopPhase.FINALIZING);
                synthesize(state, context, stream);
                return;
            }

            int iteration = state.nextIteration();
            state.enter(LoopPhase.EXECUTING_TOOL);
            ToolCall call = withId(calls.get(0));
            ToolInvocation invocation = execute(state, call, stream);

            context.add(Message.assistantToolCall(call));
            context.add(Message.toolResult(call.id(), invocation.resultJson()));
            conversation.appendTool(state.sessionId(), invocation, call.id());

            state.enter(LoopPhase.AWAITING_MODEL);
            emit(stream, StreamEvent.status("Reviewing %s results (step %d of at most %d)..."
                    .formatted(invocation.toolName(), iteration, state.maxIterations())));
        }
    }

    // ── Tool execution ───────────────────────────────────────────────────────

    private ToolInvocation execute(LoopState state, ToolCall call, TurnStream stream) {
        String   name = call.function().name();
        JsonNode args = parseArguments(state, call);
        log.info("[Agent:{}] Iteration {}: {} args={}", state.sessionId(), state.iteration(), name, args);

        emit(stream, StreamEvent.toolStart(name, args));

        Optional<ToolSpec> spec = registry.lookup(name);
        ToolInvocation invocation = spec.isPresent()
                ? dispatcher.invoke(spec.get(), args)
                : dispatcher.unknownTool(name, args);
        state.record(invocation);

        // every tool_start gets its tool_done, cancelled or not
        stream.publish(StreamEvent.toolDone(spec.map(ToolSpec::name).orElse(name), invocation.summary()));
        checkCancelled(stream);
        return invocation;
    }

    private JsonNode parseArguments(LoopState state, ToolCall call) {
        String raw = call.function().arguments();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("[Agent:{}] Unparseable arguments for {}: {}", state.sessionId(), call.function().name(), raw);
            return objectMapper.createObjectNode();
        }
    }

    /** Some providers omit tool-call ids; the result must still be linked to its call. */
    private static ToolCall withId(ToolCall call) {
        if (call.id() != null && !call.id().isBlank()) {
            return call;
        }
        return ToolCall.of("call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                call.function().name(), call.function().arguments());
    }

    // ── Finalizing ───────────────────────────────────────────────────────────

    /** Answer from the gathered context without tools, streamed live. */
    private void synthesize(LoopState state, List<Message> context, TurnStream stream) {
        List<Message> request = new ArrayList<>(context);
        request.add(Message.user(FINALIZE_INSTRUCTION));

        callModel(stream, () -> llmRouter.streamChat(ChatRequest.synthesis(request), token -> {
            if (token != null && !token.isEmpty() && !stream.isCancelled()) {
                state.appendAnswer(token);
                stream.publish(StreamEvent.token(token));
            }
        }));
        checkCancelled(stream);

        if (!state.hasAnswer()) {
            emitChunks(state, FALLBACK_ANSWER, stream);
        }
    }

    /** Replays a complete answer as token events of at most tokenChunkSize code points. */
    private void emitChunks(LoopState state, String text, TurnStream stream) {
        int size = properties.tokenChunkSize();
        int i = 0;
        while (i < text.length()) {
            int end = text.offsetByCodePoints(i, Math.min(size, text.codePointCount(i, text.length())));
            String chunk = text.substring(i, end);
            state.appendAnswer(chunk);
            emit(stream, StreamEvent.token(chunk));
            i = end;
        }
    }

    private void appendFailureNote(LoopState state, TurnStream stream) {
        List<ToolInvocation> failures = state.failures();
        if (failures.isEmpty()) {
            return;
        }
        String details = failures.stream()
                .map(f -> "%s %s".formatted(f.toolName(), f.failureKind().phrase()))
                .distinct()
                .collect(Collectors.joining("; "));
        String note = (state.hasAnswer() ? "\n\n" : "")
                + "Note: some sources were unavailable while answering (" + details + "), "
                + "so this answer may be incomplete.";
        emitChunks(state, note, stream);
    }

    // ── Model calls ──────────────────────────────────────────────────────────

    /**
     * Runs one model call, holding LLM residency on the shared GPU slot when the
     * language model lives there. Provider and residency failures become
     * {@link ModelUnavailableException}; failures caused by cancellation do not.
     */
    private <T> T callModel(TurnStream stream, Supplier<T> call) {
        Residency residency = null;
        try {
            if (gpuProperties.llmResident()) {
                residency = scheduler.acquire(ModelClass.LLM, properties.modelWait());
            }
            return call.get();
        } catch (ResidencyUnavailableException e) {
            checkCancelled(stream);
            throw new ModelUnavailableException("LLM residency unavailable: " + e.getMessage(), e);
        } catch (LlmClient.LlmException e) {
            checkCancelled(stream);
            throw new ModelUnavailableException(e.getMessage(), e);
        } finally {
            scheduler.release(residency);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void emit(TurnStream stream, StreamEvent event) {
        if (!stream.publish(event) && stream.isCancelled()) {
            throw new TurnCancelledException();
        }
    }

    private static void checkCancelled(TurnStream stream) {
        if (stream.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new TurnCancelledException();
        }
    }

    /** The client went away; the turn stops without publishing anything else. */
    static final class TurnCancelledException extends RuntimeException {
        TurnCancelledException() {
            super("turn cancelled", null, false, false);
        }
    }
}
