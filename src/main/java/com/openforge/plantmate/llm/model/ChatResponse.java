package com.openforge.plantmate.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions (also the shape the streaming
 * assembler produces once the SSE stream ends).
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices
) {

    public Message firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    public boolean hasToolCalls() {
        if (choices == null || choices.isEmpty()) return false;
        Message msg = choices.get(0).message();
        return msg != null && msg.toolCalls() != null && !msg.toolCalls().isEmpty();
    }

    /** Free text of the first choice, never null. */
    public String text() {
        String content = firstMessage().content();
        return content == null ? "" : content;
    }

    public static ChatResponse ofMessage(String id, String model, Message message, String finishReason) {
        return new ChatResponse(id, model, List.of(new Choice(0, message, finishReason)));
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}
}
