package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Correlator output: candidates ordered by descending score. Empty, with a
 * failure reason, when the run produced no evidence.
 */
@Value
@Schema(description = "Ranked root-cause candidates with confidence and supporting evidence")
public class RootCauseHypothesis {

    @Schema(description = "Candidates, highest score first")
    List<RootCauseCandidate> candidates;

    @Schema(description = "Set when no hypothesis could be formed")
    FailureReason failureReason;

    public RootCauseHypothesis(List<RootCauseCandidate> candidates, FailureReason failureReason) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.failureReason = failureReason;
    }

    public static RootCauseHypothesis of(List<RootCauseCandidate> candidates) {
        return new RootCauseHypothesis(candidates, null);
    }

    public static RootCauseHypothesis empty(FailureReason reason) {
        return new RootCauseHypothesis(List.of(), reason);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public Optional<RootCauseCandidate> top() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }
}
