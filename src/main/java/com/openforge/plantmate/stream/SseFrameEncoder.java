package com.openforge.plantmate.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Encodes one event as a server-sent-events frame: {@code data: <json>\n\n}.
 * JSON is compact and single-line, so one data line per frame is enough.
 */
@Component
@RequiredArgsConstructor
public class SseFrameEncoder {

    private static final String DATA_PREFIX = "data: ";
    private static final String TERMINATOR  = "\n\n";

    private final ObjectMapper objectMapper;

    public String encode(StreamEvent event) {
        try {
            return DATA_PREFIX + objectMapper.writeValueAsString(event) + TERMINATOR;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.type() + " event", e);
        }
    }

    public byte[] encodeBytes(StreamEvent event) {
        return encode(event).getBytes(StandardCharsets.UTF_8);
    }
}
