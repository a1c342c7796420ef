package com.delta.factengine.facts.service;

public class EngineSetupException extends RuntimeException {
    public EngineSetupException(String message) {
        super(message);
    }

    public EngineSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
