package com.openforge.plantmate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.plantmate.llm.model.ChatRequest;
import com.openforge.plantmate.llm.model.ChatResponse;
import com.openforge.plantmate.llm.model.CompletionChunk;
import com.openforge.plantmate.llm.model.Message;
import com.openforge.plantmate.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless client for one OpenAI-compatible provider (Ollama, vLLM, cloud).
 *
 *  chat()        blocking completion; used for the loop's decision step, where
 *                  the whole reply must be read before we know if a tool was requested.
 *  streamChat()  SSE completion; tokenCallback fires per content fragment.
 *                  Used for the final synthesis so tokens reach the client live.
 *
 * Both methods block the calling turn thread. Interruption surfaces as
 * {@link LlmException} with the interrupt flag restored.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(effective(request), false);
        log.debug("[LlmClient:{}] → chat body-length={}", config.name(), requestBody.length());

        HttpResponse<String> response;
        try {
            response = httpClient.send(buildHttpRequest(requestBody, false),
                    HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }

        int status = response.statusCode();
        String body = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());
        checkStatus(status, body);

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed response from provider [%s]".formatted(config.name()), e);
        }
    }

    public ChatResponse streamChat(ChatRequest request, Consumer<String> tokenCallback) {
        String requestBody = serialize(effective(request), true);
        log.debug("[LlmClient:{}] → streamChat body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while streaming from provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String snippet;
            try (Stream<String> lines = response.body()) {
                snippet = String.join("\n", lines.limit(20).toList());
            }
            checkStatus(status, snippet);
        }

        try (Stream<String> lines = response.body()) {
            return assembleStreamingResponse(lines, tokenCallback);
        } catch (UncheckedIOException e) {
            throw new LlmException("Stream from provider [%s] broke off".formatted(config.name()), e);
        }
    }

    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Streaming assembly ───────────────────────────────────────────────────

    private ChatResponse assembleStreamingResponse(Stream<String> lines, Consumer<String> tokenCallback) {
        StreamAssembly assembly = new StreamAssembly();
        for (String line : (Iterable<String>) lines::iterator) {
            if (Thread.currentThread().isInterrupted()) {
                throw new LlmException("Interrupted while reading stream from provider [%s]"
                        .formatted(config.name()));
            }
            if (!line.startsWith(SSE_DATA_PREFIX)) continue;
            String json = line.substring(SSE_DATA_PREFIX.length()).trim();
            if (SSE_DONE.equals(json)) break;
            if (json.isEmpty()) continue;

            try {
                assembly.accept(objectMapper.readValue(json, CompletionChunk.class), tokenCallback);
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Skipping unparsable SSE chunk: {}", config.name(), json);
            }
        }
        return assembly.toResponse();
    }

    /** Folds streamed chunks into the same shape a blocking call returns. */
    private static final class StreamAssembly {

        private final StringBuilder content = new StringBuilder();
        private final Map<Integer, PendingCall> calls = new TreeMap<>();
        private String id;
        private String model;
        private String finishReason;

        void accept(CompletionChunk chunk, Consumer<String> tokenCallback) {
            if (id == null)    id    = chunk.id();
            if (model == null) model = chunk.model();
            if (chunk.finishReason() != null) finishReason = chunk.finishReason();

            CompletionChunk.Delta delta = chunk.firstDelta();
            if (delta == null) return;

            if (delta.content() != null && !delta.content().isEmpty()) {
                content.append(delta.content());
                tokenCallback.accept(delta.content());
            }
            if (delta.toolCalls() != null) {
                for (CompletionChunk.ToolCallFragment fragment : delta.toolCalls()) {
                    calls.computeIfAbsent(fragment.index() != null ? fragment.index() : 0, i -> new PendingCall())
                            .merge(fragment);
                }
            }
        }

        ChatResponse toResponse() {
            List<ToolCall> toolCalls = calls.isEmpty()
                    ? null
                    : calls.values().stream().map(PendingCall::toToolCall).toList();
            Message message = Message.builder()
                    .role(Message.ASSISTANT)
                    .content(content.toString())
                    .toolCalls(toolCalls)
                    .build();
            return ChatResponse.ofMessage(id, model, message, finishReason);
        }
    }

    private static final class PendingCall {

        private String id   = "";
        private String type = "function";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();

        void merge(CompletionChunk.ToolCallFragment fragment) {
            if (fragment.id()   != null) id   = fragment.id();
            if (fragment.type() != null) type = fragment.type();
            ToolCall.Function function = fragment.function();
            if (function == null) return;
            if (function.name()      != null) name = function.name();
            if (function.arguments() != null) arguments.append(function.arguments());
        }

        ToolCall toToolCall() {
            return new ToolCall(id, type, new ToolCall.Function(name, arguments.toString()));
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatRequest effective(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]".formatted(config.name()));
        }
        return request.model() == null || request.model().isBlank()
                ? request.withModel(config.model())
                : request;
    }

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        if (streaming) {
            builder.header("Accept", "text/event-stream");
        }
        return builder.build();
    }

    private void checkStatus(int status, String body) {
        if (status == 429) {
            throw new LlmRateLimitException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String snippet = body == null ? "" : body.substring(0, Math.min(body.length(), 2048));
            throw new LlmException("Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, snippet));
        }
    }

    private String serialize(ChatRequest request, boolean stream) {
        try {
            ObjectNode node = objectMapper.valueToTree(request);
            if (stream) {
                node.put("stream", true);
            }
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
