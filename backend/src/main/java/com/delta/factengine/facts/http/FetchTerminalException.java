package com.delta.factengine.facts.http;

public class FetchTerminalException extends RuntimeException {
    public FetchTerminalException(String message) {
        super(message);
    }

    public FetchTerminalException(String message, Throwable cause) {
        super(message, cause);
    }
}
