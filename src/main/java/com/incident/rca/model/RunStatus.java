package com.incident.rca.model;

public enum RunStatus {
    COMPLETE,
    DEGRADED,
    FAILED
}
