package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one analyzer: the evidence it produced plus, when it did not finish cleanly,
 * the reason. Evidence emitted before a failure is kept alongside the failure marker.
 */
@Value
@Schema(description = "Outcome of a single analyzer run")
public class AnalyzerResult {

    @Schema(description = "Analyzer that produced this result", example = "LOG")
    EvidenceSource source;

    @Schema(description = "Evidence produced (possibly partial when failure is set)")
    List<EvidenceRecord> evidence;

    @Schema(description = "Failure marker, null on success")
    FailureReason failure;

    @Schema(description = "Wall-clock time spent in the analyzer", example = "12")
    long durationMs;

    @Builder
    private AnalyzerResult(EvidenceSource source, List<EvidenceRecord> evidence,
                           FailureReason failure, long durationMs) {
        this.source = source;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
        this.failure = failure;
        this.durationMs = durationMs;
    }

    public static AnalyzerResult success(EvidenceSource source, List<EvidenceRecord> evidence, long durationMs) {
        return new AnalyzerResult(source, evidence, null, durationMs);
    }

    public static AnalyzerResult failure(EvidenceSource source, List<EvidenceRecord> partialEvidence,
                                         FailureReason failure, long durationMs) {
        return new AnalyzerResult(source, partialEvidence, failure, durationMs);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public boolean hasEvidence() {
        return !evidence.isEmpty();
    }
}
