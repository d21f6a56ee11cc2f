package com.openforge.plantmate.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared plumbing for skill handlers: schema parsing and argument helpers.
 */
public abstract class AbstractSkillHandler implements SkillHandler {

    protected static final int MAX_SUMMARY_LENGTH = 240;

    protected final ObjectMapper objectMapper;
    private final JsonNode inputSchema;

    protected AbstractSkillHandler(ObjectMapper objectMapper, String inputSchemaJson) {
        this.objectMapper = objectMapper;
        try {
            this.inputSchema = objectMapper.readTree(inputSchemaJson);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid input schema for " + getClass().getSimpleName(), e);
        }
    }

    @Override
    public JsonNode inputSchema() {
        return inputSchema;
    }

    protected ObjectNode newBody() {
        return objectMapper.createObjectNode();
    }

    protected static String text(JsonNode arguments, String field, String fallback) {
        JsonNode node = arguments == null ? null : arguments.get(field);
        if (node == null || node.isNull()) return fallback;
        String value = node.asText();
        return value.isBlank() ? fallback : value;
    }

    protected static String firstSentence(String text) {
        if (text == null) return "";
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline > 0 ? trimmed.substring(0, newline) : trimmed;
    }

    public static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max - 1) + "…";
    }

    protected static String question(String description) {
        return """
                {
                  "type": "object",
                  "properties": {
                    "question": {
                      "type": "string",
                      "description": "%s"
                    }
                  },
                  "required": ["question"]
                }
                """.formatted(description);
    }
}
