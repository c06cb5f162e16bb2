package com.incident.rca.engine;

/**
 * Evidence {@code kind} values emitted by the built-in analyzers.
 */
public final class EvidenceKinds {

    private EvidenceKinds() {}

    public static final String METRIC_ANOMALY = "metric_anomaly";

    public static final String LOG_ERROR = "log_error";
    public static final String STACK_TRACE = "stack_trace";
    public static final String LOG_ANOMALY = "log_anomaly";
    // Aggregate counts, context rather than a finding
    public static final String LOG_SUMMARY = "log_summary";

    public static final String SPOF = "spof";
    public static final String SCALABILITY_RISK = "scalability_risk";

    public static final String NARRATIVE = "narrative";

    public static boolean isSummary(String kind) {
        return LOG_SUMMARY.equals(kind);
    }
}
