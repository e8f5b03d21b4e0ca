package com.cliniq.engine.exception;

public class ConcurrencyException extends EngineException {

    public ConcurrencyException(String message, Throwable cause) {
        super("CONCURRENCY_ERROR", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
