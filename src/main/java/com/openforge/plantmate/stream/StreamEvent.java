package com.openforge.plantmate.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The single envelope written to the client stream. Each tag fills only its own
 * fields; everything else is null and omitted, so the serialized shapes are:
 *
 *   {"type":"status","text":...}
 *   {"type":"tool_start","tool":...,"input":{...}}
 *   {"type":"tool_done","tool":...,"summary":...}
 *   {"type":"token","content":...}
 *   {"type":"done","message_id":...}
 *   {"type":"error","detail":...}
 *
 * Never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "text", "tool", "input", "summary", "content", "message_id", "detail"})
public record StreamEvent(
        @JsonProperty("type")       EventType type,
        @JsonProperty("text")       String    text,
        @JsonProperty("tool")       String    tool,
        @JsonProperty("input")      JsonNode  input,
        @JsonProperty("summary")    String    summary,
        @JsonProperty("content")    String    content,
        @JsonProperty("message_id") String    messageId,
        @JsonProperty("detail")     String    detail
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static StreamEvent status(String text) {
        return new StreamEvent(EventType.STATUS, text, null, null, null, null, null, null);
    }

    public static StreamEvent toolStart(String tool, JsonNode input) {
        return new StreamEvent(EventType.TOOL_START, null, tool, input, null, null, null, null);
    }

    public static StreamEvent toolDone(String tool, String summary) {
        return new StreamEvent(EventType.TOOL_DONE, null, tool, null, summary, null, null, null);
    }

    public static StreamEvent token(String content) {
        return new StreamEvent(EventType.TOKEN, null, null, null, null, content, null, null);
    }

    public static StreamEvent done(String messageId) {
        return new StreamEvent(EventType.DONE, null, null, null, null, null, messageId, null);
    }

    public static StreamEvent error(String detail) {
        return new StreamEvent(EventType.ERROR, null, null, null, null, null, null, detail);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }
}
