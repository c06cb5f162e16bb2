package com.incident.rca.service;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.config.MetricsConfig;
import com.incident.rca.model.AnalyzerResult;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureReason;
import com.incident.rca.model.FailureType;
import com.incident.rca.model.InputSummary;
import com.incident.rca.model.PipelineRun;
import com.incident.rca.model.Postmortem;
import com.incident.rca.model.RootCauseHypothesis;
import com.incident.rca.model.RunStatus;
import com.incident.rca.model.Severity;
import com.incident.rca.reasoning.BoundedReasoningClient;
import com.incident.rca.reasoning.ReasoningBackend;
import com.incident.rca.reasoning.ReasoningPrompts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.incident.rca.testutil.TestDataFactory.createEvidence;
import static com.incident.rca.testutil.TestDataFactory.failedResult;
import static com.incident.rca.testutil.TestDataFactory.successResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostmortemServiceTest {

    private static final List<String> NODES = List.of("api", "orders-db");

    @Mock
    private ReasoningBackend backend;

    private AnalysisConfig config;
    private ExecutorService executor;
    private RootCauseCorrelationService correlationService;

    @BeforeEach
    void setUp() {
        config = new AnalysisConfig();
        executor = Executors.newFixedThreadPool(2);
        correlationService = new RootCauseCorrelationService(config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void compose_completeRun_templateWithAllSections() {
        Postmortem postmortem = service(null).compose(designRun());

        assertThat(postmortem.getTitle()).isEqualTo("Postmortem: orders-db");
        assertThat(postmortem.getRootCause()).isEqualTo("orders-db");
        assertThat(postmortem.getConfidence()).isEqualTo(1.0);
        assertThat(postmortem.getGeneratedBy()).isEqualTo("TEMPLATE");
        assertThat(postmortem.getMarkdown())
                .startsWith("# Postmortem: orders-db")
                .contains("## What Happened", "## Impact", "## Root Cause", "## Evidence",
                        "## Timeline", "## Action Items")
                .contains("Checkout returning 500s")
                .contains("- [ ] Increase replicas of orders-db to at least 2");
    }

    @Test
    void compose_failedRun_rootCauseUndetermined() {
        PipelineRun run = PipelineRun.builder()
                .runId("run-1")
                .startedAt(Instant.now())
                .completedAt(Instant.now())
                .inputs(InputSummary.builder().logLength(-1).metricNames(List.of("cpu")).nodeNames(List.of()).build())
                .metricsResult(failedResult(EvidenceSource.METRICS, FailureType.INPUT_MALFORMED))
                .hypothesis(RootCauseHypothesis.empty(
                        FailureReason.of(FailureType.NO_EVIDENCE_PRODUCED, "All analyzers failed")))
                .status(RunStatus.FAILED)
                .build();

        Postmortem postmortem = service(null).compose(run);

        assertThat(postmortem.getTitle()).isEqualTo("Postmortem: root cause undetermined");
        assertThat(postmortem.getRootCause()).isEqualTo("unknown");
        assertThat(postmortem.getConfidence()).isEqualTo(0.0);
        assertThat(postmortem.getActionItems())
                .containsExactly("Fix metrics input and re-run analysis (INPUT_MALFORMED: boom)");
        assertThat(postmortem.getMarkdown())
                .contains("Undetermined: All analyzers failed.")
                .contains("No incident description was provided.")
                .contains("No supporting evidence.");
    }

    @Test
    void actionItems_oneItemPerDesignRule() {
        List<EvidenceRecord> design = List.of(
                createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.0,
                        Map.of("node", "orders-db", "rule", "single_replica")),
                createEvidence(EvidenceSource.DESIGN, "scalability_risk", Severity.WARNING, 1.0,
                        Map.of("node", "orders-db", "rule", "stateful_no_read_replicas")),
                createEvidence(EvidenceSource.DESIGN, "scalability_risk", Severity.WARNING, 1.0,
                        Map.of("node", "ledger", "rule", "cross_zone", "callers", "api")),
                createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.0,
                        Map.of("node", "a", "rule", "sync_cycle", "members", "a,b")),
                createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.0,
                        Map.of("node", "orders-db", "rule", "single_replica")));

        List<String> items = service(null).actionItems(run(successResult(EvidenceSource.DESIGN,
                design.toArray(new EvidenceRecord[0])), null, RunStatus.COMPLETE));

        assertThat(items).containsExactly(
                "Increase replicas of orders-db to at least 2",
                "Add read replicas to orders-db to spread read load",
                "Distribute ledger across at least 2 zones or co-locate it with its callers (api)",
                "Break the synchronous call cycle among [a,b] with async messaging or a circuit breaker");
    }

    @Test
    void actionItems_topCandidateFromMetrics_investigateItem() {
        EvidenceRecord anomaly = createEvidence(EvidenceSource.METRICS, "metric_anomaly", Severity.CRITICAL, 1.0,
                Map.of("metric", "api.latency"));

        List<String> items = service(null).actionItems(
                run(null, successResult(EvidenceSource.METRICS, anomaly), RunStatus.COMPLETE));

        assertThat(items).containsExactly("Investigate api: " + anomaly.getDescription());
    }

    @Test
    void compose_backendPolishesDraft_usesBackendMarkdown() throws Exception {
        config.getReasoning().setEnabled(true);
        when(backend.complete(eq(ReasoningPrompts.POSTMORTEM), anyMap()))
                .thenReturn("```markdown\n# Postmortem: orders-db\n\n## What Happened\n\nPolished.\n```");

        Postmortem postmortem = service(backend).compose(designRun());

        assertThat(postmortem.getGeneratedBy()).isEqualTo("REASONING_BACKEND");
        assertThat(postmortem.getMarkdown()).isEqualTo("# Postmortem: orders-db\n\n## What Happened\n\nPolished.");
        assertThat(postmortem.getActionItems()).containsExactly("Increase replicas of orders-db to at least 2");
    }

    @Test
    void compose_backendAnswersWithoutMarkdown_keepsTemplate() throws Exception {
        config.getReasoning().setEnabled(true);
        when(backend.complete(eq(ReasoningPrompts.POSTMORTEM), anyMap())).thenReturn("Sure! Here is your postmortem.");

        Postmortem postmortem = service(backend).compose(designRun());

        assertThat(postmortem.getGeneratedBy()).isEqualTo("TEMPLATE");
        assertThat(postmortem.getMarkdown()).startsWith("# Postmortem: orders-db");
    }

    @Test
    void compose_failedRun_backendNotCalled() {
        config.getReasoning().setEnabled(true);
        PipelineRun run = PipelineRun.builder()
                .runId("run-2")
                .hypothesis(RootCauseHypothesis.empty(
                        FailureReason.of(FailureType.NO_EVIDENCE_PRODUCED, "No inputs were supplied")))
                .status(RunStatus.FAILED)
                .build();

        Postmortem postmortem = service(backend).compose(run);

        assertThat(postmortem.getGeneratedBy()).isEqualTo("TEMPLATE");
        assertThat(postmortem.getActionItems()).isEmpty();
        assertThat(postmortem.getMarkdown()).contains("No concrete action items were derived");
        verifyNoInteractions(backend);
    }

    @Test
    void stripFence_removesMarkdownFenceOnly() {
        assertThat(PostmortemService.stripFence("```md\n# Title\n```")).isEqualTo("# Title");
        assertThat(PostmortemService.stripFence("# Title")).isEqualTo("# Title");
        assertThat(PostmortemService.stripFence("```")).isEqualTo("```");
    }

    private PostmortemService service(ReasoningBackend reasoningBackend) {
        BoundedReasoningClient client = new BoundedReasoningClient(reasoningBackend, executor, config,
                new MetricsConfig(new SimpleMeterRegistry()));
        return new PostmortemService(client, config);
    }

    private PipelineRun designRun() {
        EvidenceRecord spof = createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.0,
                Map.of("node", "orders-db", "rule", "single_replica"));
        PipelineRun run = run(successResult(EvidenceSource.DESIGN, spof), null, RunStatus.COMPLETE);
        return PipelineRun.builder()
                .runId(run.getRunId())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .inputs(InputSummary.builder()
                        .description("Checkout returning 500s")
                        .logLength(-1)
                        .metricNames(List.of())
                        .nodeNames(NODES)
                        .connectionCount(1)
                        .build())
                .designResult(run.getDesignResult())
                .hypothesis(run.getHypothesis())
                .status(run.getStatus())
                .build();
    }

    private PipelineRun run(AnalyzerResult designResult, AnalyzerResult metricsResult, RunStatus status) {
        List<EvidenceRecord> evidence = new ArrayList<>();
        if (designResult != null) {
            evidence.addAll(designResult.getEvidence());
        }
        if (metricsResult != null) {
            evidence.addAll(metricsResult.getEvidence());
        }
        return PipelineRun.builder()
                .runId("run-test")
                .startedAt(Instant.now())
                .completedAt(Instant.now())
                .designResult(designResult)
                .metricsResult(metricsResult)
                .hypothesis(correlationService.correlate(evidence, NODES))
                .status(status)
                .build();
    }
}
