package com.incident.rca.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
