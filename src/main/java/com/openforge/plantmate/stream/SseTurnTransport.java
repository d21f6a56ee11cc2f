package com.openforge.plantmate.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Drains a {@link TurnStream} into a Spring MVC response, one SSE frame per event.
 *
 * Frames are written as raw UTF-8 bytes rather than through {@code SseEmitter},
 * whose {@code data:} prefix has no space and whose string converter defaults to
 * ISO-8859-1. The response completes right after the terminal frame. A failed
 * write, an async timeout or a dropped connection cancels the turn.
 */
@Slf4j
@Component
public class SseTurnTransport {

    public static final MediaType TEXT_EVENT_STREAM = MediaType.TEXT_EVENT_STREAM;

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    private final SseFrameEncoder  encoder;
    private final ExecutorService  executor;
    private final StreamProperties properties;

    public SseTurnTransport(SseFrameEncoder encoder,
                            @Qualifier("agentTurnExecutor") ExecutorService executor,
                            StreamProperties properties) {
        this.encoder    = encoder;
        this.executor   = executor;
        this.properties = properties;
    }

    public TurnStream newStream(String sessionId) {
        return new TurnStream(sessionId, properties.queueCapacity(), properties.publishTimeout());
    }

    /** Opens the response and starts draining {@code stream} in the background. */
    public ResponseEntity<ResponseBodyEmitter> open(TurnStream stream) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(properties.emitterTimeout().toMillis());
        emitter.onTimeout(() -> {
            log.info("[SSE:{}] Emitter timed out", stream.sessionId());
            stream.cancel();
        });
        emitter.onError(error -> {
            log.info("[SSE:{}] Connection error: {}", stream.sessionId(), error.getMessage());
            stream.cancel();
        });

        executor.execute(() -> drain(stream, emitter));

        return ResponseEntity.ok()
                .contentType(TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    void drain(TurnStream stream, ResponseBodyEmitter emitter) {
        try {
            while (!stream.isCancelled()) {
                StreamEvent event = stream.poll(POLL_INTERVAL);
                if (event == null) {
                    continue;
                }
                emitter.send(encoder.encodeBytes(event), MediaType.APPLICATION_OCTET_STREAM);
                if (event.isTerminal()) {
                    emitter.complete();
                    return;
                }
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.info("[SSE:{}] Client gone: {}", stream.sessionId(), e.getMessage());
            stream.cancel();
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.cancel();
            emitter.complete();
        }
    }
}
