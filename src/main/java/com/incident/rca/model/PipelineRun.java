package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Top-level aggregate of one pipeline invocation. Assembled by the orchestrator as stages
 * settle and frozen when returned; nothing holds a reference to it afterwards.
 * An analyzer result is null when its input was not supplied.
 */
@Value
@Builder
@Schema(description = "Frozen result of one root-cause analysis run")
public class PipelineRun {

    @Schema(example = "4f1c2a0e-0d0b-4b7e-9a53-3c8a5f2b9e11")
    String runId;

    Instant startedAt;

    Instant completedAt;

    @Schema(description = "References to the run's inputs")
    InputSummary inputs;

    @Schema(description = "Log analyzer outcome, null when no logs were supplied")
    AnalyzerResult logResult;

    @Schema(description = "Anomaly detector outcome, null when no metrics were supplied")
    AnalyzerResult metricsResult;

    @Schema(description = "Design analyzer outcome, null when no service graph was supplied")
    AnalyzerResult designResult;

    @Singular("reasoningRecord")
    @Schema(description = "Narrative evidence added by the reasoning backend")
    List<EvidenceRecord> reasoningEvidence;

    @Singular
    @Schema(description = "Backend calls that did not succeed and degraded the run")
    List<FailureReason> degradations;

    RootCauseHypothesis hypothesis;

    @Schema(example = "DEGRADED")
    RunStatus status;

    /** Analyzer results that were actually run, in source priority order. */
    public List<AnalyzerResult> analyzerResults() {
        List<AnalyzerResult> results = new ArrayList<>(3);
        Stream.of(designResult, metricsResult, logResult)
                .filter(result -> result != null)
                .forEach(results::add);
        return results;
    }

    /** Evidence from analyzers and the reasoning backend, in source priority order. */
    public List<EvidenceRecord> allEvidence() {
        List<EvidenceRecord> all = new ArrayList<>();
        analyzerResults().forEach(result -> all.addAll(result.getEvidence()));
        all.addAll(reasoningEvidence);
        return all;
    }
}
