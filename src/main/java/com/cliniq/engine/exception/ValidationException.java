package com.cliniq.engine.exception;

public class ValidationException extends EngineException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
