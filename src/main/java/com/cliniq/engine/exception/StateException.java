package com.cliniq.engine.exception;

/**
 * Illegal status transition, or a transition blocked by the current state of related rows.
 */
public class StateException extends EngineException {

    public StateException(String message) {
        super("STATE_ERROR", message);
    }
}
