package com.openforge.plantmate.agent;

/**
 * The language model cannot be reached for this turn: every provider failed, or
 * the LLM could not be made resident. Fatal to the turn.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
