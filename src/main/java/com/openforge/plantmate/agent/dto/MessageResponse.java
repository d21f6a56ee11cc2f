package com.openforge.plantmate.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.plantmate.domain.ChatMessage;

import java.time.LocalDateTime;

/**
 * One entry of GET /sessions/{id}/messages. Tool input and result are the
 * stored JSON texts, passed through unparsed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(

        @JsonProperty("id")          String        id,
        @JsonProperty("role")        String        role,
        @JsonProperty("content")     String        content,
        @JsonProperty("tool_name")   String        toolName,
        @JsonProperty("tool_input")  String        toolInput,
        @JsonProperty("tool_result") String        toolResult,
        @JsonProperty("created_at")  LocalDateTime createdAt
) {

    public static MessageResponse from(ChatMessage message) {
        return new MessageResponse(
                message.getMessageId(),
                message.getRole().name().toLowerCase(),
                message.getContent(),
                message.getToolName(),
                message.getToolInput(),
                message.getToolResult(),
                message.getCreateTime()
        );
    }
}
