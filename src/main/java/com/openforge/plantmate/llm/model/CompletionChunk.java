package com.openforge.plantmate.llm.model;

import java.util.List;

/**
 * Payload of one "data:" line of a streamed completion; the stream ends with "data: [DONE]".
 *
 * Content arrives as text fragments. A tool call arrives in pieces keyed by
 * {@link ToolCallFragment#index()}: id and name first, the argument string spread
 * over the following lines.
 */
public record CompletionChunk(
        String id,
        String model,
        List<Choice> choices
) {

    public Delta firstDelta() {
        return choices == null || choices.isEmpty() ? null : choices.get(0).delta();
    }

    public String finishReason() {
        return choices == null || choices.isEmpty() ? null : choices.get(0).finishReason();
    }

    public record Choice(
            int index,
            Delta delta,
            String finishReason
    ) {}

    public record Delta(
            String role,
            String content,
            List<ToolCallFragment> toolCalls
    ) {}

    public record ToolCallFragment(
            Integer index,
            String id,
            String type,
            ToolCall.Function function
    ) {}
}
