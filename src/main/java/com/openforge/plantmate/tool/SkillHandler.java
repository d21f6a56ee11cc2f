package com.openforge.plantmate.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Per-tool behaviour around the single HTTP call the dispatcher makes:
 * what the model is told, how its arguments become a request body, and how
 * the response is reduced to a one-line summary for the client stream.
 *
 * Exactly one bean per {@link ToolName}.
 */
public interface SkillHandler {

    ToolName toolName();

    String description();

    JsonNode inputSchema();

    /** Shapes the POST body from the model-supplied arguments (may be empty, never null). */
    JsonNode requestBody(JsonNode arguments);

    /** Extra request headers, e.g. an API key. */
    default Map<String, String> headers() {
        return Map.of();
    }

    /** Short human-readable digest of a successful response; never the raw payload. */
    String summarize(JsonNode response);

    /** False when the tool cannot work in this deployment and must not be offered to the model. */
    default boolean isAvailable() {
        return true;
    }
}
