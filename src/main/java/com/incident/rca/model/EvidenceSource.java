package com.incident.rca.model;

/**
 * Where a piece of evidence came from. Declaration order is the fixed tie-break
 * priority used when ranking root-cause candidates: design > metrics > log > reasoning.
 */
public enum EvidenceSource {
    DESIGN,
    METRICS,
    LOG,
    REASONING;

    /** Lower value = higher priority. */
    public int priority() {
        return ordinal();
    }

    public boolean outranks(EvidenceSource other) {
        return other == null || priority() < other.priority();
    }
}
