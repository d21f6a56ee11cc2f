package com.openforge.plantmate.agent;

/**
 * States of one turn.
 *
 *   AWAITING_MODEL → EXECUTING_TOOL → AWAITING_MODEL … → FINALIZING → DONE
 *   any state → FAILED
 */
public enum LoopPhase {

    AWAITING_MODEL,

    EXECUTING_TOOL,

    FINALIZING,

    DONE,

    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
