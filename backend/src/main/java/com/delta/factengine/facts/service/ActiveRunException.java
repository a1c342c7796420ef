package com.delta.factengine.facts.service;

public class ActiveRunException extends RuntimeException {
    public ActiveRunException(String message) {
        super(message);
    }
}
