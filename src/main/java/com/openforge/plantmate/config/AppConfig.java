package com.openforge.plantmate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - turn executor  → one task per chat turn plus one per SSE transport drain
 *  - Java HttpClient → the only HTTP engine, shared by LLM, skills and GPU swaps
 *  - ObjectMapper    → snake_case wire names, ISO dates, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Cached pool: turns block on model and tool I/O for minutes at a time,
     * so threads are created on demand and reaped after a minute idle.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentTurnExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "agent-turn-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    /**
     * Single shared HttpClient. Connect timeout is short; read budgets are
     * set per request from the tool spec / provider config.
     */
    @Bean
    public HttpClient httpClient(ExecutorService agentTurnExecutor) {
        return HttpClient.newBuilder()
                .executor(agentTurnExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
