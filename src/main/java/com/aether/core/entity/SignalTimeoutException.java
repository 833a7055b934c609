package com.aether.core.entity;

/**
 * Thrown when an agent's actor does not answer a synchronous signal in time.
 * The signal may still be processed later.
 */
public class SignalTimeoutException extends RuntimeException {
    public SignalTimeoutException(String message) {
        super(message);
    }

    public SignalTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
