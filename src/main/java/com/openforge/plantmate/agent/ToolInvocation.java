package com.openforge.plantmate.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one tool call, successful or not. Failures are values here, not
 * exceptions: the loop hands {@link #resultJson()} to the model either way.
 *
 * @param resultJson  tool response on success, otherwise {"error":...,"detail":...}
 * @param summary     short text shown to the client in tool_done
 * @param failureKind null on success
 */
public record ToolInvocation(
        String      toolName,
        JsonNode    input,
        Instant     startedAt,
        Duration    elapsed,
        Outcome     outcome,
        FailureKind failureKind,
        String      resultJson,
        String      summary
) {

    public enum Outcome {
        SUCCESS,
        TIMEOUT,
        TRANSPORT_ERROR,
        REJECTED
    }

    public enum FailureKind {
        /** Residency could not be acquired, or the tool is unknown / not offered. */
        TOOL_REJECTED("was rejected"),
        /** The end-to-end budget ran out (or the turn was cancelled). */
        TOOL_TIMEOUT("timed out"),
        /** Connection failure, non-2xx status or malformed response. */
        TOOL_TRANSPORT_ERROR("was unreachable"),
        /** The GPU model swap this tool needed exceeded its budget. */
        SWAP_TIMEOUT("could not get its model loaded in time");

        private final String phrase;

        FailureKind(String phrase) {
            this.phrase = phrase;
        }

        public String phrase() {
            return phrase;
        }
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }
}
