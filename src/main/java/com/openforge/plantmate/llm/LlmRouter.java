package com.openforge.plantmate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.llm.model.ChatRequest;
import com.openforge.plantmate.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Routes language-model calls through primary → fallback, each wrapped in
 * its own circuit breaker + retry.
 *
 *   chat(request) / streamChat(request, tokenCallback)
 *     └─ primaryCircuitBreaker + primaryRetry → primary provider
 *           ↓ (breaker open or call failed)
 *     └─ fallbackCircuitBreaker + fallbackRetry → fallback provider (if configured)
 *
 * A stream that already pushed tokens to the caller is never restarted, neither
 * by a retry nor on the fallback: the client would see the answer twice. Such
 * failures propagate.
 */
@Slf4j
@Component
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     @Qualifier("primaryLlmCircuitBreaker") CircuitBreaker primaryLlmCircuitBreaker,
                     @Qualifier("fallbackLlmCircuitBreaker") CircuitBreaker fallbackLlmCircuitBreaker,
                     @Qualifier("primaryLlmRetry") Retry primaryLlmRetry,
                     @Qualifier("fallbackLlmRetry") Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.hasFallback() ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = request.withModel(primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null || Thread.currentThread().isInterrupted()) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());
            ChatRequest fallbackRequest = request.withModel(fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    public ChatResponse streamChat(ChatRequest request, Consumer<String> tokenCallback) {
        AtomicBoolean delivered = new AtomicBoolean(false);
        Consumer<String> tracking = token -> {
            delivered.set(true);
            tokenCallback.accept(token);
        };
        try {
            ChatRequest primaryRequest = request.withModel(primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    untilFirstToken(delivered, () -> primaryClient.streamChat(primaryRequest, tracking)), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null || delivered.get() || Thread.currentThread().isInterrupted()) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary stream failed before first token ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());
            ChatRequest fallbackRequest = request.withModel(fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    untilFirstToken(delivered, () -> fallbackClient.streamChat(fallbackRequest, tracking)), "fallback");
        }
    }

    public String primaryProvider() {
        return primaryClient.providerName();
    }

    /** Once a token went out, failures are wrapped so the retry policy no longer matches them. */
    private static Supplier<ChatResponse> untilFirstToken(AtomicBoolean delivered, Supplier<ChatResponse> call) {
        return () -> {
            try {
                return call.get();
            } catch (LlmClient.LlmException e) {
                if (delivered.get()) {
                    throw new LlmClient.LlmException("Stream broke after first token: " + e.getMessage(), e);
                }
                throw e;
            }
        };
    }

    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (LlmClient.LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "%s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
