package com.openforge.plantmate.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One entry of the context sent to /chat/completions.
 *
 * The plant assistant only ever produces these shapes:
 *   system    the instructions, always first
 *   user      the engineer's question
 *   assistant free text, or exactly one tool call with empty content
 *   tool      the skill's JSON (or failure object), linked by toolCallId
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL      = "tool";

    public static Message system(String content) {
        return new Message(SYSTEM, content, null, null);
    }

    public static Message user(String content) {
        return new Message(USER, content, null, null);
    }

    public static Message assistantText(String content) {
        return new Message(ASSISTANT, content, null, null);
    }

    public static Message assistantToolCall(ToolCall toolCall) {
        return new Message(ASSISTANT, "", List.of(toolCall), null);
    }

    public static Message toolResult(String toolCallId, String result) {
        return new Message(TOOL, result, null, toolCallId);
    }

    /** A tool result is only valid right after the assistant message that requested it. */
    @JsonIgnore
    public boolean isToolResult() {
        return TOOL.equals(role);
    }
}
