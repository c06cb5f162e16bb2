package com.incident.rca.exception;

/**
 * The reasoning backend could not be reached or failed to answer.
 */
public class ReasoningBackendException extends Exception {
    public ReasoningBackendException(String message) {
        super(message);
    }

    public ReasoningBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
