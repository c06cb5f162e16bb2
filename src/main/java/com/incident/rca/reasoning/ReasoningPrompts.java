package com.incident.rca.reasoning;

import com.incident.rca.model.EvidenceSource;

/**
 * Task prompts sent to the reasoning backend. The structured findings travel separately as
 * the call context.
 */
public final class ReasoningPrompts {

    private ReasoningPrompts() {}

    public static final String ROOT_CAUSE = """
            Given structured findings from logs, metrics and design review, plus the ranked \
            candidate components, infer the single most likely root cause.
            Return STRICT JSON with keys: root_cause (string), confidence_score (0..1 float), \
            explanation (string).
            Respond only with a JSON object and no additional text.""";

    public static final String POSTMORTEM = """
            Polish this postmortem draft in Markdown. Keep the sections What Happened, Impact, \
            Root Cause, Evidence, Timeline and Action Items. Use the draft and context as the \
            source of truth; do not invent facts. Keep it short and actionable.""";

    public static String enrichment(EvidenceSource source) {
        return switch (source) {
            case LOG -> "Explain in at most 5 lines what these log findings suggest about the failure, "
                    + "most significant first. Ground every statement in the findings.";
            case METRICS -> "Explain in at most 5 lines which metric anomalies are most likely related to "
                    + "the incident and how they connect. Ground every statement in the findings.";
            case DESIGN -> "Provide a concise explanation (at most 10 lines) of the structural risks, "
                    + "redundancy improvements and scalability concerns, with prioritized recommendations.";
            case REASONING -> "Summarize these findings in at most 5 lines.";
        };
    }
}
