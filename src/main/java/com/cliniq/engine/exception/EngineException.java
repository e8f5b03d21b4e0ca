package com.cliniq.engine.exception;

/**
 * Base of every rejection the engine reports to callers. {@code code} is stable
 * and machine readable; the message is meant for people.
 */
public abstract class EngineException extends RuntimeException {

    private final String code;

    protected EngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected EngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Whether re-issuing the same single operation may succeed. */
    public boolean isRetryable() {
        return false;
    }
}
