package com.incident.rca.exception;

/**
 * Structurally invalid input handed to an analyzer. Fatal to that analyzer only.
 */
public class InputMalformedException extends RuntimeException {
    public InputMalformedException(String message) {
        super(message);
    }
}
