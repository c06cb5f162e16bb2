package com.incident.rca.service;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureType;
import com.incident.rca.model.RootCauseCandidate;
import com.incident.rca.model.RootCauseHypothesis;
import com.incident.rca.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.incident.rca.testutil.TestDataFactory.createEvidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RootCauseCorrelationServiceTest {

    private static final List<String> NODES = List.of("api", "orders", "orders-db");

    private AnalysisConfig config;
    private RootCauseCorrelationService service;

    @BeforeEach
    void setUp() {
        config = new AnalysisConfig();
        service = new RootCauseCorrelationService(config);
    }

    @Test
    void correlate_noEvidence_emptyHypothesisWithReason() {
        RootCauseHypothesis hypothesis = service.correlate(List.of(), NODES);

        assertThat(hypothesis.isEmpty()).isTrue();
        assertThat(hypothesis.getFailureReason().getType()).isEqualTo(FailureType.NO_EVIDENCE_PRODUCED);
    }

    @Test
    void correlate_onlySummaryRecords_emptyHypothesis() {
        EvidenceRecord summary = createEvidence(EvidenceSource.LOG, "log_summary", Severity.INFO, 1.0,
                Map.of("total_lines", 10));

        assertThat(service.correlate(List.of(summary), NODES).isEmpty()).isTrue();
    }

    @Test
    void correlate_criticalDesignFinding_scoresOne() {
        RootCauseHypothesis hypothesis = service.correlate(
                List.of(createEvidence(EvidenceSource.DESIGN, Severity.CRITICAL, "orders-db")), NODES);

        RootCauseCandidate top = hypothesis.top().orElseThrow();
        assertThat(top.getComponent()).isEqualTo("orders-db");
        assertThat(top.getScore()).isEqualTo(1.0);
        assertThat(top.getTopSource()).isEqualTo(EvidenceSource.DESIGN);
    }

    @Test
    void correlate_mixedSources_averagesWeightedConfidence() {
        // (1.0 x 1.0 x 1.5 + 0.5 x 0.9 x 1.0) / (2 x 1.0 x 1.5) = 0.65
        EvidenceRecord design = createEvidence(EvidenceSource.DESIGN, Severity.CRITICAL, "orders-db");
        EvidenceRecord metric = createEvidence(EvidenceSource.METRICS, "metric_anomaly", Severity.WARNING, 0.5,
                Map.of("metric", "orders-db.latency"));

        RootCauseCandidate top = service.correlate(List.of(metric, design), NODES).top().orElseThrow();

        assertThat(top.getScore()).isCloseTo(0.65, within(1e-9));
        assertThat(top.getTopSource()).isEqualTo(EvidenceSource.DESIGN);
        assertThat(top.getEvidence()).containsExactly(design, metric);
    }

    @Test
    void correlate_candidatesOrderedByDescendingScore() {
        List<EvidenceRecord> evidence = List.of(
                createEvidence(EvidenceSource.LOG, "log_anomaly", Severity.INFO, 1.0, Map.of("excerpt", "api slow")),
                createEvidence(EvidenceSource.METRICS, "metric_anomaly", Severity.CRITICAL, 1.0,
                        Map.of("metric", "orders-db.latency")),
                createEvidence(EvidenceSource.LOG, "log_error", Severity.WARNING, 1.0, Map.of("excerpt", "orders retry")));

        List<RootCauseCandidate> candidates = service.correlate(evidence, NODES).getCandidates();

        assertThat(candidates).extracting(RootCauseCandidate::getComponent)
                .containsExactly("orders-db", "orders", "api");
        for (int i = 1; i < candidates.size(); i++) {
            assertThat(candidates.get(i).getScore()).isLessThanOrEqualTo(candidates.get(i - 1).getScore());
        }
    }

    @Test
    void correlate_equalScores_tieBrokenBySourcePriorityThenName() {
        // 0.9 x 1.0 x 1.0 == 1.0 x 0.9 x 1.0
        List<EvidenceRecord> evidence = List.of(
                createEvidence(EvidenceSource.METRICS, "metric_anomaly", Severity.WARNING, 1.0, Map.of("metric", "api")),
                createEvidence(EvidenceSource.DESIGN, "spof", Severity.WARNING, 0.9, Map.of("node", "orders-db")),
                createEvidence(EvidenceSource.DESIGN, "spof", Severity.WARNING, 0.9, Map.of("node", "orders")));

        List<RootCauseCandidate> candidates = service.correlate(evidence, NODES).getCandidates();

        assertThat(candidates).extracting(RootCauseCandidate::getComponent)
                .containsExactly("orders", "orders-db", "api");
        assertThat(candidates).extracting(RootCauseCandidate::getScore).containsOnly(0.6);
    }

    @Test
    void correlate_malformedRecords_skipped() {
        List<EvidenceRecord> evidence = new ArrayList<>();
        evidence.add(createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.5, Map.of("node", "api")));
        evidence.add(createEvidence(EvidenceSource.DESIGN, " ", Severity.CRITICAL, 1.0, Map.of("node", "api")));
        evidence.add(createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, Double.NaN, Map.of("node", "api")));
        evidence.add(null);
        evidence.add(createEvidence(EvidenceSource.LOG, Severity.WARNING, "orders"));

        RootCauseHypothesis hypothesis = service.correlate(evidence, NODES);

        assertThat(hypothesis.getCandidates()).extracting(RootCauseCandidate::getComponent).containsExactly("orders");
    }

    @Test
    void correlate_noNodeNames_everythingUnknown() {
        RootCauseHypothesis hypothesis = service.correlate(List.of(
                createEvidence(EvidenceSource.LOG, Severity.WARNING, "orders-db"),
                createEvidence(EvidenceSource.METRICS, Severity.CRITICAL, "api")), List.of());

        assertThat(hypothesis.getCandidates()).hasSize(1);
        assertThat(hypothesis.getCandidates().get(0).getComponent()).isEqualTo("unknown");
        assertThat(hypothesis.getCandidates().get(0).getEvidence()).hasSize(2);
    }

    @Test
    void correlate_templateRationale_listsTopEvidence() {
        EvidenceRecord design = createEvidence(EvidenceSource.DESIGN, Severity.CRITICAL, "orders-db");

        RootCauseCandidate top = service.correlate(List.of(design), NODES).top().orElseThrow();

        assertThat(top.getRationale()).isEqualTo("orders-db: 1 supporting finding(s). Top evidence: "
                + design.getDescription());
    }

    @Test
    void correlate_customWeights_changeRanking() {
        config.getScoring().getSourceWeights().put(EvidenceSource.LOG, 2.0);
        List<EvidenceRecord> evidence = List.of(
                createEvidence(EvidenceSource.DESIGN, Severity.WARNING, "api"),
                createEvidence(EvidenceSource.LOG, Severity.WARNING, "orders"));

        List<RootCauseCandidate> candidates = service.correlate(evidence, NODES).getCandidates();

        assertThat(candidates.get(0).getComponent()).isEqualTo("orders");
    }

    @Test
    void attribute_exactMatchWinsOverSubstring() {
        EvidenceRecord record = createEvidence(EvidenceSource.DESIGN, "spof", Severity.CRITICAL, 1.0,
                Map.of("node", "orders"));

        assertThat(RootCauseCorrelationService.attribute(record, NODES)).isEqualTo("orders");
    }

    @Test
    void attribute_longestSubstringCaseInsensitive() {
        EvidenceRecord record = createEvidence(EvidenceSource.LOG, "log_error", Severity.WARNING, 1.0,
                Map.of("excerpt", "Timeout talking to ORDERS-DB primary"));

        assertThat(RootCauseCorrelationService.attribute(record, NODES)).isEqualTo("orders-db");
    }

    @Test
    void attribute_noMatch_unknown() {
        EvidenceRecord record = createEvidence(EvidenceSource.LOG, "log_error", Severity.WARNING, 1.0,
                Map.of("excerpt", "kernel panic", "line", 3));

        assertThat(RootCauseCorrelationService.attribute(record, NODES)).isEqualTo("unknown");
    }

    @Test
    void attachNarrative_replacesTopRationaleOnly() {
        RootCauseHypothesis hypothesis = service.correlate(List.of(
                createEvidence(EvidenceSource.DESIGN, Severity.CRITICAL, "orders-db"),
                createEvidence(EvidenceSource.LOG, Severity.WARNING, "api")), NODES);
        String secondRationale = hypothesis.getCandidates().get(1).getRationale();

        RootCauseHypothesis narrated = service.attachNarrative(hypothesis, "  pool exhaustion on orders-db  ");

        assertThat(narrated.getCandidates().get(0).getRationale()).isEqualTo("pool exhaustion on orders-db");
        assertThat(narrated.getCandidates().get(0).getScore()).isEqualTo(hypothesis.getCandidates().get(0).getScore());
        assertThat(narrated.getCandidates().get(1).getRationale()).isEqualTo(secondRationale);
    }

    @Test
    void attachNarrative_blankOrEmptyHypothesis_unchanged() {
        RootCauseHypothesis empty = service.correlate(List.of(), NODES);
        RootCauseHypothesis hypothesis = service.correlate(List.of(
                createEvidence(EvidenceSource.DESIGN, Severity.CRITICAL, "orders-db")), NODES);

        assertThat(service.attachNarrative(empty, "text")).isSameAs(empty);
        assertThat(service.attachNarrative(hypothesis, " ")).isSameAs(hypothesis);
    }
}
