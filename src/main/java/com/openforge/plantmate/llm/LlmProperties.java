package com.openforge.plantmate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Language-model provider configuration, bound from "agent.llm":
 *
 * agent:
 *   llm:
 *     primary:
 *       name: ollama-gpu
 *       base-url: http://ollama-gpu:11434/v1
 *       api-key: ollama
 *       model: qwen3:30b
 *       timeout-seconds: 120
 *     fallback:            # optional
 *       name: vllm
 *       base-url: http://vllm:8000/v1
 *       model: qwen3-30b
 *     resilience:
 *       failure-rate-threshold: 50
 *       wait-in-open-state: 30s
 *       max-attempts: 2
 *       retry-wait: 1s
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback,
        @DefaultValue Resilience resilience
) {

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    public record Resilience(
            @DefaultValue("50") float failureRateThreshold,
            @DefaultValue("30s") Duration waitInOpenState,
            @DefaultValue("2") int maxAttempts,
            @DefaultValue("1s") Duration retryWait
    ) {}
}
