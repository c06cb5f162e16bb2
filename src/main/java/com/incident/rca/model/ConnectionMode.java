package com.incident.rca.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum ConnectionMode {
    SYNC,
    ASYNC;

    /** Unknown or missing modes are treated as synchronous, the more conservative reading. */
    @JsonCreator
    public static ConnectionMode fromString(String mode) {
        if (mode == null) {
            return SYNC;
        }
        return "async".equalsIgnoreCase(mode.trim()) ? ASYNC : SYNC;
    }
}
