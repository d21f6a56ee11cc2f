package com.openforge.plantmate.agent;

import com.openforge.plantmate.stream.SseTurnTransport;
import com.openforge.plantmate.stream.TurnStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts turns on the turn executor and enforces one in-flight turn per session.
 *
 * Cancelling a turn's stream (client disconnect, stalled reader) interrupts the
 * turn's thread, which unblocks model calls, tool calls and residency waits.
 */
@Slf4j
@Component
public class TurnLauncher {

    private final AgentLoopService        agentLoopService;
    private final SseTurnTransport        transport;
    private final ExecutorService         executor;
    private final Map<String, TurnStream> activeTurns = new ConcurrentHashMap<>();

    public TurnLauncher(AgentLoopService agentLoopService,
                        SseTurnTransport transport,
                        @Qualifier("agentTurnExecutor") ExecutorService executor) {
        this.agentLoopService = agentLoopService;
        this.transport        = transport;
        this.executor         = executor;
    }

    public ResponseEntity<ResponseBodyEmitter> start(String sessionId, String content) {
        TurnStream stream = transport.newStream(sessionId);
        if (activeTurns.putIfAbsent(sessionId, stream) != null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "A message is already being processed for session " + sessionId);
        }

        Future<?> turn;
        try {
            turn = executor.submit(() -> {
                try {
                    agentLoopService.runTurn(sessionId, content, stream);
                } catch (Exception e) {
                    log.error("[Launcher] Uncaught exception in turn for session {}: {}",
                            sessionId, e.getMessage(), e);
                } finally {
                    activeTurns.remove(sessionId, stream);
                }
            });
        } catch (RejectedExecutionException e) {
            activeTurns.remove(sessionId, stream);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Server is shutting down");
        }
        stream.onCancel(() -> turn.cancel(true));

        return transport.open(stream);
    }
}
