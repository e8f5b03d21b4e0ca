package com.cliniq.engine.exception;

/**
 * The doctor's schedule lacks something an operation needs, e.g. no appointment duration.
 */
public class ConfigurationException extends EngineException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
