package com.incident.rca.model;

public enum FailureType {
    // Structurally invalid input; fatal to that analyzer only
    INPUT_MALFORMED,
    // Uncaught error inside an analyzer
    ANALYZER_CRASHED,
    // Reasoning backend unreachable or timed out; degrades the run
    BACKEND_UNAVAILABLE,
    // Reasoning backend answered with something unusable; fallback used
    BACKEND_MALFORMED_RESPONSE,
    // No analyzer produced any evidence; fatal to the run
    NO_EVIDENCE_PRODUCED
}
