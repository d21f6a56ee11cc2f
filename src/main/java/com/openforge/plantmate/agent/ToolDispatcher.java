package com.openforge.plantmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.plantmate.agent.ToolInvocation.FailureKind;
import com.openforge.plantmate.agent.ToolInvocation.Outcome;
import com.openforge.plantmate.gpu.GpuResidencyScheduler;
import com.openforge.plantmate.gpu.Residency;
import com.openforge.plantmate.gpu.ResidencyUnavailableException;
import com.openforge.plantmate.gpu.SwapTimeoutException;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.SkillHandler;
import com.openforge.plantmate.tool.ToolRegistry;
import com.openforge.plantmate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues exactly one tool call under the tool's wall-clock budget.
 *
 *   1. acquire residency for the tool's model class (budget = whole timeout)
 *        failure → REJECTED, the endpoint is never called
 *   2. POST the shaped body with whatever budget is left
 *        budget spent / interrupted → TIMEOUT
 *        connection error / non-2xx / bad JSON → TRANSPORT_ERROR
 *   3. release residency, always
 *
 * Never retries and never throws for tool-level failures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

    private static final int MAX_ERROR_DETAIL = 500;

    private final HttpClient            httpClient;
    private final ObjectMapper          objectMapper;
    private final GpuResidencyScheduler scheduler;
    private final ToolRegistry          registry;

    public ToolInvocation invoke(ToolSpec spec, JsonNode input) {
        Instant startedAt = Instant.now();
        long    start     = System.nanoTime();
        long    deadline  = start + spec.timeout().toNanos();
        JsonNode args     = input != null && input.isObject() ? input : objectMapper.createObjectNode();
        Call call         = new Call(spec, args, startedAt, start);

        SkillHandler handler = registry.handlerFor(spec.tool());
        Residency residency = null;
        try {
            if (spec.requiredModelClass().requiresResidency()) {
                try {
                    residency = scheduler.acquire(spec.requiredModelClass(), spec.timeout());
                } catch (SwapTimeoutException e) {
                    return call.failed(Outcome.REJECTED, FailureKind.SWAP_TIMEOUT, e.getMessage());
                } catch (ResidencyUnavailableException e) {
                    if (Thread.currentThread().isInterrupted()) {
                        return call.failed(Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT, "cancelled while waiting for the GPU");
                    }
                    return call.failed(Outcome.REJECTED, FailureKind.TOOL_REJECTED, e.getMessage());
                }
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return call.failed(Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT,
                        "no time left after waiting for the GPU (budget %ds)".formatted(spec.timeout().toSeconds()));
            }
            return post(call, handler, remaining);
        } finally {
            scheduler.release(residency);
        }
    }

    /** The model named a tool that is not registered; recorded like any other rejection. */
    public ToolInvocation unknownTool(String name, JsonNode input) {
        log.warn("[Dispatcher:{}] Unknown tool requested", name);
        JsonNode args = input != null && input.isObject() ? input : objectMapper.createObjectNode();
        String result = objectMapper.createObjectNode().put("error", "Unknown tool: " + name).toString();
        return new ToolInvocation(name, args, Instant.now(), Duration.ZERO,
                Outcome.REJECTED, FailureKind.TOOL_REJECTED, result, "Error: unknown tool");
    }

    private ToolInvocation post(Call call, SkillHandler handler, long remainingNanos) {
        ToolSpec spec = call.spec;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(spec.endpoint())
                .header("Content-Type", "application/json")
                .timeout(Duration.ofNanos(remainingNanos));
        handler.headers().forEach(builder::header);

        String body;
        try {
            body = objectMapper.writeValueAsString(handler.requestBody(call.args));
        } catch (JsonProcessingException e) {
            return call.failed(Outcome.TRANSPORT_ERROR, FailureKind.TOOL_TRANSPORT_ERROR, "cannot encode request: " + e.getMessage());
        }
        log.debug("[Dispatcher:{}] POST {} body={}", spec.name(), spec.endpoint(), body);

        CompletableFuture<HttpResponse<String>> future = httpClient.sendAsync(
                builder.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        HttpResponse<String> response;
        try {
            response = future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return call.failed(Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT,
                    "no answer within %ds".formatted(spec.timeout().toSeconds()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return call.failed(Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT, "cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                return call.failed(Outcome.TIMEOUT, FailureKind.TOOL_TIMEOUT,
                        "no answer within %ds".formatted(spec.timeout().toSeconds()));
            }
            return call.failed(Outcome.TRANSPORT_ERROR, FailureKind.TOOL_TRANSPORT_ERROR,
                    cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage()));
        }

        if (response.statusCode() / 100 != 2) {
            String detail = response.body() == null ? "" : response.body();
            return call.failed(Outcome.TRANSPORT_ERROR, FailureKind.TOOL_TRANSPORT_ERROR,
                    "HTTP " + response.statusCode(), AbstractSkillHandler.truncate(detail, MAX_ERROR_DETAIL));
        }

        JsonNode result;
        try {
            result = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return call.failed(Outcome.TRANSPORT_ERROR, FailureKind.TOOL_TRANSPORT_ERROR, "malformed JSON response");
        }
        if (result == null || result.isMissingNode()) {
            return call.failed(Outcome.TRANSPORT_ERROR, FailureKind.TOOL_TRANSPORT_ERROR, "empty response");
        }

        String summary = AbstractSkillHandler.truncate(handler.summarize(result), 240);
        return call.succeeded(result.toString(), summary);
    }

    /** Per-call bookkeeping that turns any exit into a {@link ToolInvocation}. */
    private final class Call {

        final ToolSpec spec;
        final JsonNode args;
        final Instant  startedAt;
        final long     startNanos;

        Call(ToolSpec spec, JsonNode args, Instant startedAt, long startNanos) {
            this.spec       = spec;
            this.args       = args;
            this.startedAt  = startedAt;
            this.startNanos = startNanos;
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        ToolInvocation succeeded(String resultJson, String summary) {
            Duration elapsed = elapsed();
            log.info("[Dispatcher:{}] OK in {}ms: {}", spec.name(), elapsed.toMillis(), summary);
            return new ToolInvocation(spec.name(), args, startedAt, elapsed,
                    Outcome.SUCCESS, null, resultJson, summary);
        }

        ToolInvocation failed(Outcome outcome, FailureKind kind, String error) {
            return failed(outcome, kind, error, null);
        }

        ToolInvocation failed(Outcome outcome, FailureKind kind, String error, String detail) {
            Duration elapsed = elapsed();
            log.warn("[Dispatcher:{}] {} ({}) after {}ms: {}", spec.name(), outcome, kind, elapsed.toMillis(), error);
            ObjectNode payload = objectMapper.createObjectNode().put("error", error);
            if (detail != null && !detail.isBlank()) {
                payload.put("detail", detail);
            }
            return new ToolInvocation(spec.name(), args, startedAt, elapsed,
                    outcome, kind, payload.toString(), failureSummary(kind, error));
        }
    }

    static String failureSummary(FailureKind kind, String error) {
        return switch (kind) {
            case TOOL_TIMEOUT         -> "Tool timed out";
            case SWAP_TIMEOUT         -> "GPU model swap timed out";
            case TOOL_REJECTED        -> "Tool unavailable: " + AbstractSkillHandler.truncate(error, 200);
            case TOOL_TRANSPORT_ERROR -> "Error: " + AbstractSkillHandler.truncate(error, 200);
        };
    }
}
