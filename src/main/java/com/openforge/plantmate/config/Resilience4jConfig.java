package com.openforge.plantmate.config;

import com.openforge.plantmate.llm.LlmClient;
import com.openforge.plantmate.llm.LlmProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for the language-model providers only.
 *
 * Skill calls are not covered: the dispatcher makes exactly one attempt
 * and the model decides whether to ask again.
 *
 * Retries are limited to failures that happen before any response byte is read
 * (connection errors, HTTP 429), so a half-streamed answer is never replayed.
 */
@Configuration
public class Resilience4jConfig {

    static final String PRIMARY  = "primaryLlm";
    static final String FALLBACK = "fallbackLlm";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(LlmProperties llmProperties) {
        LlmProperties.Resilience resilience = llmProperties.resilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(resilience.failureRateThreshold())
                // a healthy GPU model can take close to two minutes on a cold context
                .slowCallDurationThreshold(Duration.ofSeconds(150))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(resilience.waitInOpenState())
                .recordExceptions(LlmClient.LlmException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(PRIMARY);
        registry.circuitBreaker(FALLBACK);
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(PRIMARY);
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(FALLBACK);
    }

    @Bean
    public RetryRegistry retryRegistry(LlmProperties llmProperties) {
        LlmProperties.Resilience resilience = llmProperties.resilience();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, resilience.maxAttempts()))
                .waitDuration(resilience.retryWait())
                .retryOnException(Resilience4jConfig::isRetryable)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(PRIMARY);
        registry.retry(FALLBACK);
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry(PRIMARY);
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry(FALLBACK);
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof LlmClient.LlmRateLimitException) {
            return true;
        }
        return error instanceof LlmClient.LlmException && error.getCause() instanceof IOException;
    }
}
