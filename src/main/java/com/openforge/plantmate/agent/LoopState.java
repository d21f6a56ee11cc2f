package com.openforge.plantmate.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one turn, owned by the thread running it.
 */
@Slf4j
class LoopState {

    private final String               sessionId;
    private final int                  maxIterations;
    private final StringBuilder        answer      = new StringBuilder();
    private final List<ToolInvocation> invocations = new ArrayList<>();

    private LoopPhase phase = LoopPhase.AWAITING_MODEL;
    private int       iteration;

    LoopState(String sessionId, int maxIterations) {
        this.sessionId     = sessionId;
        this.maxIterations = maxIterations;
    }

    String sessionId()    { return sessionId; }
    int iteration()       { return iteration; }
    int maxIterations()   { return maxIterations; }
    LoopPhase phase()     { return phase; }
    String answer()       { return answer.toString(); }

    void enter(LoopPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Turn already " + phase + ", cannot enter " + next);
        }
        log.debug("[Agent:{}] {} → {}", sessionId, phase, next);
        phase = next;
    }

    /** True when another tool call would exceed the iteration bound. */
    boolean iterationBoundReached() {
        return iteration >= maxIterations;
    }

    int nextIteration() {
        return ++iteration;
    }

    void appendAnswer(String fragment) {
        answer.append(fragment);
    }

    boolean hasAnswer() {
        return !answer.toString().isBlank();
    }

    void record(ToolInvocation invocation) {
        invocations.add(invocation);
    }

    List<ToolInvocation> failures() {
        return invocations.stream().filter(i -> !i.succeeded()).toList();
    }
}
