package com.openforge.plantmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A skill offered to the model in the request's "tools" array:
 * {"type":"function","function":{"name":...,"description":...,"parameters":{schema}}}.
 */
public record ToolDefinition(
        String type,
        Function function
) {

    public static ToolDefinition of(String name, String description, JsonNode parameters) {
        return new ToolDefinition("function", new Function(name, description, parameters));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(
            String name,
            String description,
            JsonNode parameters
    ) {}
}
