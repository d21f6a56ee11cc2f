package com.openforge.plantmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for an OpenAI-compatible /chat/completions endpoint.
 *
 * The agent loop issues two kinds of request:
 *   decision:  tools attached, toolChoice "auto"; the model picks a skill or answers
 *   synthesis: no tools; the model must answer from the context it already has
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<ToolDefinition> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int    DEFAULT_MAX_TOKENS  = 4096;

    public static ChatRequest decision(List<Message> messages, List<ToolDefinition> tools) {
        return ChatRequest.builder()
                .messages(messages)
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .temperature(DEFAULT_TEMPERATURE)
                .maxTokens(DEFAULT_MAX_TOKENS)
                .build();
    }

    public static ChatRequest synthesis(List<Message> messages) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(DEFAULT_TEMPERATURE)
                .maxTokens(DEFAULT_MAX_TOKENS)
                .build();
    }

    public ChatRequest withModel(String modelName) {
        return toBuilder().model(modelName).build();
    }
}
