package com.incident.rca.service;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.config.MetricsConfig;
import com.incident.rca.engine.Analyzer;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.engine.analyzers.AnomalyDetector;
import com.incident.rca.engine.analyzers.DesignAnalyzer;
import com.incident.rca.engine.analyzers.LogAnalyzer;
import com.incident.rca.model.AnalyzerResult;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureReason;
import com.incident.rca.model.FailureType;
import com.incident.rca.model.IncidentRequest;
import com.incident.rca.model.InputSummary;
import com.incident.rca.model.PipelineRun;
import com.incident.rca.model.RootCauseCandidate;
import com.incident.rca.model.RootCauseHypothesis;
import com.incident.rca.model.RunStatus;
import com.incident.rca.model.Severity;
import com.incident.rca.reasoning.BoundedReasoningClient;
import com.incident.rca.reasoning.BoundedReasoningClient.PendingCall;
import com.incident.rca.reasoning.ReasoningOutcome;
import com.incident.rca.reasoning.ReasoningPrompts;
import com.incident.rca.reasoning.RootCauseNarrative;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Main orchestrator for one root-cause analysis run.
 *
 * Flow:
 * 1. Start the analyzers whose input is present, concurrently on the pipeline executor
 * 2. Wait until every analyzer has settled (success or failure)
 * 3. If reasoning is available, enrich each analyzer's evidence (one bounded call each)
 * 4. Correlate all evidence into a ranked hypothesis
 * 5. If reasoning is available, ask for a root-cause narrative for the top candidate
 * 6. Derive the run status and return the frozen PipelineRun
 *
 * Analyzer failures are captured in their results and never escape this class. Backend
 * failures and timeouts degrade the run; they never fail it.
 */
@Service
public class PipelineOrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrationService.class);

    static final String ENRICH_PURPOSE = "enrich";
    static final String NARRATIVE_PURPOSE = "narrative";

    // Bounds the structured context sent per backend call
    private static final int MAX_CONTEXT_RECORDS = 50;
    private static final int MAX_CONTEXT_CANDIDATES = 5;

    private final LogAnalyzer logAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final DesignAnalyzer designAnalyzer;
    private final RootCauseCorrelationService correlationService;
    private final BoundedReasoningClient reasoningClient;
    private final AnalysisConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final ExecutorService executor;

    public PipelineOrchestrationService(LogAnalyzer logAnalyzer,
                                        AnomalyDetector anomalyDetector,
                                        DesignAnalyzer designAnalyzer,
                                        RootCauseCorrelationService correlationService,
                                        BoundedReasoningClient reasoningClient,
                                        AnalysisConfig config,
                                        MetricsConfig metricsConfig,
                                        Tracer tracer,
                                        @Qualifier("pipelineExecutor") ExecutorService executor) {
        this.logAnalyzer = logAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.designAnalyzer = designAnalyzer;
        this.correlationService = correlationService;
        this.reasoningClient = reasoningClient;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.executor = executor;
    }

    /**
     * Run the pipeline over one incident. Never throws for analyzer or backend problems.
     */
    @Observed(name = "pipeline.run", contextualName = "run-pipeline")
    public PipelineRun run(IncidentRequest request) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        long deadlineNanos = System.nanoTime()
                + TimeUnit.MILLISECONDS.toNanos(config.getReasoning().getRunDeadlineMs());

        PipelineRun.PipelineRunBuilder run = PipelineRun.builder()
                .runId(runId)
                .startedAt(startedAt)
                .inputs(InputSummary.of(request));

        log.info("Pipeline run {} started: logs={}, metrics={}, design={}",
                runId, request.hasLogs(), request.hasMetrics(), request.hasDesign());

        // 1. Start one task per present input; each owns exactly one result field
        CompletableFuture<AnalyzerResult> designTask = request.hasDesign()
                ? launch(designAnalyzer, request.getDesign()) : null;
        CompletableFuture<AnalyzerResult> metricsTask = request.hasMetrics()
                ? launch(anomalyDetector, request.getMetrics()) : null;
        CompletableFuture<AnalyzerResult> logTask = request.hasLogs()
                ? launch(logAnalyzer, request.getLogs()) : null;

        // 2. The correlator must never see partial analyzer output
        AnalyzerResult designResult = settle(designTask, EvidenceSource.DESIGN);
        AnalyzerResult metricsResult = settle(metricsTask, EvidenceSource.METRICS);
        AnalyzerResult logResult = settle(logTask, EvidenceSource.LOG);
        run.designResult(designResult).metricsResult(metricsResult).logResult(logResult);

        List<AnalyzerResult> results = new ArrayList<>(3);
        for (AnalyzerResult result : new AnalyzerResult[]{designResult, metricsResult, logResult}) {
            if (result != null) {
                results.add(result);
                record(result);
            }
        }

        boolean anyEvidence = results.stream().anyMatch(AnalyzerResult::hasEvidence);
        boolean anyFailed = results.stream().anyMatch(AnalyzerResult::isFailed);
        if (results.isEmpty() || (!anyEvidence && results.stream().allMatch(AnalyzerResult::isFailed))) {
            String reason = results.isEmpty() ? "No inputs were supplied" : "All analyzers failed";
            log.warn("Pipeline run {} failed: {}", runId, reason);
            return finish(run, RunStatus.FAILED,
                    RootCauseHypothesis.empty(FailureReason.of(FailureType.NO_EVIDENCE_PRODUCED, reason)));
        }

        // 3. Best-effort enrichment, all calls in flight together
        List<FailureReason> degradations = new ArrayList<>();
        List<EvidenceRecord> reasoningEvidence = new ArrayList<>();
        boolean reasoning = reasoningClient.isAvailable();
        if (reasoning) {
            enrich(results, deadlineNanos, reasoningEvidence, degradations);
        }

        // 4. Correlate
        List<EvidenceRecord> evidence = new ArrayList<>();
        results.forEach(result -> evidence.addAll(result.getEvidence()));
        evidence.addAll(reasoningEvidence);
        List<String> nodeNames = request.hasDesign() ? request.getDesign().nodeNames() : List.of();
        RootCauseHypothesis hypothesis = correlationService.correlate(evidence, nodeNames);

        // 5. Narrative for the top candidate
        if (reasoning && !hypothesis.isEmpty()) {
            hypothesis = narrate(request, hypothesis, deadlineNanos, degradations);
        }

        run.reasoningEvidence(reasoningEvidence).degradations(degradations);

        // 6. Status
        RunStatus status = anyFailed || !degradations.isEmpty() ? RunStatus.DEGRADED : RunStatus.COMPLETE;
        return finish(run, status, hypothesis);
    }

    private <I> CompletableFuture<AnalyzerResult> launch(Analyzer<I> analyzer, I input) {
        try {
            return CompletableFuture.supplyAsync(() -> traced(analyzer, input), executor);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule {} analyzer", analyzer.getSource(), e);
            return CompletableFuture.completedFuture(AnalyzerResult.failure(analyzer.getSource(), List.of(),
                    FailureReason.of(FailureType.ANALYZER_CRASHED, "Analyzer could not be scheduled"), 0));
        }
    }

    private <I> AnalyzerResult traced(Analyzer<I> analyzer, I input) {
        EvidenceSource source = analyzer.getSource();
        Span span = tracer.nextSpan()
                .name("analyzer." + source.name().toLowerCase(Locale.ROOT))
                .tag("analyzer.source", source.name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            AnalyzerResult result = analyzer.analyze(input);
            span.tag("analyzer.evidence", String.valueOf(result.getEvidence().size()));
            if (result.isFailed()) {
                span.tag("analyzer.failure", result.getFailure().getType().name());
            }
            return result;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Wait for one analyzer. Anything that escaped the analyzer becomes a crash result. */
    private AnalyzerResult settle(CompletableFuture<AnalyzerResult> task, EvidenceSource source) {
        if (task == null) {
            return null;
        }
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} analyzer crashed outside its own error handling", source, cause);
            return AnalyzerResult.failure(source, List.of(),
                    FailureReason.of(FailureType.ANALYZER_CRASHED,
                            cause.getClass().getSimpleName() + ": " + cause.getMessage()), 0);
        }
    }

    private void record(AnalyzerResult result) {
        metricsConfig.recordEvidence(result.getSource().name(), result.getEvidence().size());
        if (result.isFailed()) {
            metricsConfig.recordAnalyzerFailure(result.getSource().name(), result.getFailure().getType().name());
            log.warn("{} analyzer failed ({}): {} [{} partial record(s) kept]",
                    result.getSource(), result.getFailure().getType(), result.getFailure().getMessage(),
                    result.getEvidence().size());
        } else {
            log.debug("{} analyzer produced {} record(s) in {}ms",
                    result.getSource(), result.getEvidence().size(), result.getDurationMs());
        }
    }

    private void enrich(List<AnalyzerResult> results, long deadlineNanos,
                        List<EvidenceRecord> reasoningEvidence, List<FailureReason> degradations) {
        Map<EvidenceSource, PendingCall> calls = new LinkedHashMap<>();
        for (AnalyzerResult result : results) {
            if (result.hasEvidence()) {
                calls.put(result.getSource(), reasoningClient.submit(ENRICH_PURPOSE,
                        ReasoningPrompts.enrichment(result.getSource()), enrichmentContext(result), deadlineNanos));
            }
        }

        for (Map.Entry<EvidenceSource, PendingCall> entry : calls.entrySet()) {
            ReasoningOutcome outcome = reasoningClient.await(entry.getValue());
            if (outcome.isSuccess()) {
                reasoningEvidence.add(narrativeRecord(entry.getKey(), outcome.text()));
            } else if (outcome.isUnavailable()) {
                degradations.add(outcome.failure());
            }
        }
    }

    private RootCauseHypothesis narrate(IncidentRequest request, RootCauseHypothesis hypothesis,
                                        long deadlineNanos, List<FailureReason> degradations) {
        ReasoningOutcome outcome = reasoningClient.call(NARRATIVE_PURPOSE, ReasoningPrompts.ROOT_CAUSE,
                narrativeContext(request, hypothesis), deadlineNanos);
        if (outcome.isUnavailable()) {
            degradations.add(outcome.failure());
            return hypothesis;
        }
        if (!outcome.isSuccess()) {
            return hypothesis;
        }

        Optional<RootCauseNarrative> narrative = RootCauseNarrative.parse(outcome.text());
        if (narrative.isEmpty()) {
            reasoningClient.rejectMalformed(outcome, "No JSON object with an explanation");
            return hypothesis;
        }
        return correlationService.attachNarrative(hypothesis, narrative.get().toRationale());
    }

    private PipelineRun finish(PipelineRun.PipelineRunBuilder run, RunStatus status, RootCauseHypothesis hypothesis) {
        PipelineRun frozen = run.hypothesis(hypothesis)
                .status(status)
                .completedAt(Instant.now())
                .build();

        metricsConfig.recordRun(status.name(), hypothesis.getCandidates().size());
        log.info("Pipeline run {} finished: status={}, candidates={}, top={}",
                frozen.getRunId(), status, hypothesis.getCandidates().size(),
                hypothesis.top().map(RootCauseCandidate::getComponent).orElse("none"));
        return frozen;
    }

    private static EvidenceRecord narrativeRecord(EvidenceSource analyzer, String text) {
        String narrative = text.strip();
        String firstLine = narrative.lines().findFirst().orElse("");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("analyzer", analyzer.name());
        attributes.put("narrative", narrative);

        return EvidenceRecord.builder()
                .source(EvidenceSource.REASONING)
                .kind(EvidenceKinds.NARRATIVE)
                .severity(Severity.INFO)
                .description("Reasoning on " + analyzer.name().toLowerCase(Locale.ROOT) + " findings: "
                        + (firstLine.length() > 200 ? firstLine.substring(0, 200) : firstLine))
                .attributes(attributes)
                .confidence(0.5)
                .build();
    }

    private static Map<String, Object> enrichmentContext(AnalyzerResult result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("analyzer", result.getSource().name());
        context.put("findings", result.getEvidence().stream()
                .limit(MAX_CONTEXT_RECORDS)
                .map(PipelineOrchestrationService::findingOf)
                .toList());
        context.put("total_findings", result.getEvidence().size());
        return context;
    }

    private static Map<String, Object> narrativeContext(IncidentRequest request, RootCauseHypothesis hypothesis) {
        List<Map<String, Object>> candidates = new ArrayList<>();
        for (RootCauseCandidate candidate : hypothesis.getCandidates()) {
            if (candidates.size() == MAX_CONTEXT_CANDIDATES) {
                break;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("component", candidate.getComponent());
            entry.put("score", candidate.getScore());
            entry.put("top_source", candidate.getTopSource().name());
            entry.put("findings", candidate.getEvidence().stream()
                    .limit(MAX_CONTEXT_RECORDS)
                    .map(PipelineOrchestrationService::findingOf)
                    .toList());
            candidates.add(entry);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("incident", request.getDescription() == null ? "" : request.getDescription());
        context.put("candidates", candidates);
        return context;
    }

    private static Map<String, Object> findingOf(EvidenceRecord record) {
        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("source", record.getSource().name());
        finding.put("kind", record.getKind());
        finding.put("severity", record.getSeverity().name());
        finding.put("description", record.getDescription());
        finding.put("attributes", record.getAttributes());
        return finding;
    }
}
