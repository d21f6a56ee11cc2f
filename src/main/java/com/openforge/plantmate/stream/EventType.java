package com.openforge.plantmate.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag of every event a turn pushes to its client.
 *
 * Flow: STATUS → (TOOL_START → TOOL_DONE)* → TOKEN* → DONE, or ERROR at any point.
 */
public enum EventType {

    /** Human-readable phase description. */
    STATUS("status"),

    /** A tool is about to be invoked with the given input. */
    TOOL_START("tool_start"),

    /** The tool finished (or failed); carries a short summary, never the raw payload. */
    TOOL_DONE("tool_done"),

    /** One fragment of the final answer, in order. */
    TOKEN("token"),

    /** Terminal: answer persisted under message_id. */
    DONE("done"),

    /** Terminal: the turn failed. */
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
