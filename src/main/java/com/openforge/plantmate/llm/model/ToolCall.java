package com.openforge.plantmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A skill the model asked for, e.g. name = "inventory_sql_search",
 * arguments = "{\"question\":\"PA6 stock\"}". The loop answers with
 * {@link Message#toolResult(String, String)} carrying the same id.
 *
 * Arguments stay a raw JSON string, as sent by the provider; the loop parses them.
 */
public record ToolCall(
        String id,
        String type,
        Function function
) {

    public static ToolCall of(String id, String name, String arguments) {
        return new ToolCall(id, "function", new Function(name, arguments));
    }

    /** In streamed fragments either field may be null. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(
            String name,
            String arguments
    ) {}
}
