package com.incident.rca.service;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureReason;
import com.incident.rca.model.FailureType;
import com.incident.rca.model.RootCauseCandidate;
import com.incident.rca.model.RootCauseHypothesis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Merges evidence from every source into a ranked list of suspected components.
 *
 * Attribution: a record belongs to the first node whose name exactly equals one of its
 * string attributes (attribute order), else to the longest node name contained in one of
 * them (case-insensitive, ties alphabetical), else to "unknown".
 *
 * Score per component = Σ(confidence × sourceWeight × severityMultiplier)
 *                       / (n × maxSourceWeight × maxSeverityMultiplier)
 * where n is the component's record count, so a component with only critical design
 * findings at full confidence scores 1.0. Rounded to 4 decimals.
 *
 * Ranking: score descending, then the best source priority among contributors
 * (design > metrics > log > reasoning), then component name.
 */
@Service
public class RootCauseCorrelationService {

    private static final Logger log = LoggerFactory.getLogger(RootCauseCorrelationService.class);

    public static final String UNKNOWN_COMPONENT = "unknown";

    private final AnalysisConfig config;

    public RootCauseCorrelationService(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Rank candidate root causes.
     *
     * @param evidence  evidence from all sources; malformed records are skipped
     * @param nodeNames known service graph node names, may be empty
     */
    public RootCauseHypothesis correlate(List<EvidenceRecord> evidence, List<String> nodeNames) {
        AnalysisConfig.Scoring scoring = config.getScoring();
        double norm = scoring.maxWeight() * scoring.maxMultiplier();
        List<String> nodes = nodeNames == null ? List.of() : nodeNames;

        Map<String, List<Contribution>> byComponent = new TreeMap<>();
        int skipped = 0;
        for (EvidenceRecord record : evidence) {
            if (!isWellFormed(record)) {
                skipped++;
                log.warn("Skipping malformed evidence record: {}", record);
                continue;
            }
            if (EvidenceKinds.isSummary(record.getKind())) {
                continue;
            }
            double weighted = record.getConfidence()
                    * scoring.weightOf(record.getSource())
                    * scoring.multiplierOf(record.getSeverity());
            byComponent.computeIfAbsent(attribute(record, nodes), k -> new ArrayList<>())
                    .add(new Contribution(record, weighted));
        }

        if (byComponent.isEmpty()) {
            log.info("No scorable evidence ({} malformed record(s) skipped)", skipped);
            return RootCauseHypothesis.empty(FailureReason.of(FailureType.NO_EVIDENCE_PRODUCED,
                    "No scorable evidence to correlate"));
        }

        List<RootCauseCandidate> candidates = new ArrayList<>(byComponent.size());
        for (Map.Entry<String, List<Contribution>> entry : byComponent.entrySet()) {
            candidates.add(toCandidate(entry.getKey(), entry.getValue(), norm, scoring.getRationaleEvidenceCount()));
        }
        candidates.sort(RANKING);

        log.debug("Correlated {} component(s), top={} score={}", candidates.size(),
                candidates.get(0).getComponent(), candidates.get(0).getScore());
        return RootCauseHypothesis.of(candidates);
    }

    /**
     * Replace the top candidate's rationale with a backend narrative. Other candidates keep
     * their deterministic rationale.
     */
    public RootCauseHypothesis attachNarrative(RootCauseHypothesis hypothesis, String narrative) {
        if (hypothesis.isEmpty() || narrative == null || narrative.isBlank()) {
            return hypothesis;
        }
        List<RootCauseCandidate> candidates = new ArrayList<>(hypothesis.getCandidates());
        candidates.set(0, candidates.get(0).withRationale(narrative.strip()));
        return new RootCauseHypothesis(candidates, hypothesis.getFailureReason());
    }

    static final Comparator<RootCauseCandidate> RANKING = Comparator
            .comparingDouble(RootCauseCandidate::getScore).reversed()
            .thenComparingInt(candidate -> candidate.getTopSource().priority())
            .thenComparing(RootCauseCandidate::getComponent);

    private RootCauseCandidate toCandidate(String component, List<Contribution> contributions,
                                           double norm, int rationaleCount) {
        double sum = 0.0;
        EvidenceSource topSource = null;
        for (Contribution contribution : contributions) {
            sum += contribution.weighted();
            EvidenceSource source = contribution.record().getSource();
            if (source.outranks(topSource)) {
                topSource = source;
            }
        }
        double score = norm > 0 ? sum / (contributions.size() * norm) : 0.0;
        score = Math.max(0.0, Math.min(1.0, score));

        // Strongest first; stable sort keeps production order among equals
        List<Contribution> ordered = new ArrayList<>(contributions);
        ordered.sort(Comparator.comparingDouble(Contribution::weighted).reversed());
        List<EvidenceRecord> records = ordered.stream().map(Contribution::record).toList();

        return RootCauseCandidate.builder()
                .component(component)
                .score(Math.round(score * 10_000.0) / 10_000.0)
                .topSource(topSource)
                .evidence(records)
                .rationale(templateRationale(component, records, rationaleCount))
                .build();
    }

    private static String templateRationale(String component, List<EvidenceRecord> records, int count) {
        String top = records.stream()
                .limit(Math.max(1, count))
                .map(EvidenceRecord::getDescription)
                .collect(Collectors.joining("; "));
        return String.format(Locale.ROOT, "%s: %d supporting finding(s). Top evidence: %s",
                component, records.size(), top);
    }

    /** Affected component for one record. */
    static String attribute(EvidenceRecord record, List<String> nodeNames) {
        if (nodeNames.isEmpty()) {
            return UNKNOWN_COMPONENT;
        }
        List<String> values = new ArrayList<>();
        for (Object value : record.getAttributes().values()) {
            if (value instanceof String) {
                values.add((String) value);
            }
        }

        for (String value : values) {
            if (nodeNames.contains(value)) {
                return value;
            }
        }

        String best = null;
        for (String node : nodeNames) {
            String needle = node.toLowerCase(Locale.ROOT);
            boolean found = false;
            for (String value : values) {
                if (value.toLowerCase(Locale.ROOT).contains(needle)) {
                    found = true;
                    break;
                }
            }
            if (found && (best == null
                    || node.length() > best.length()
                    || (node.length() == best.length() && node.compareTo(best) < 0))) {
                best = node;
            }
        }
        return best != null ? best : UNKNOWN_COMPONENT;
    }

    static boolean isWellFormed(EvidenceRecord record) {
        return record != null
                && record.getSource() != null
                && record.getKind() != null
                && !record.getKind().isBlank()
                && record.getSeverity() != null
                && !Double.isNaN(record.getConfidence())
                && record.getConfidence() >= 0.0
                && record.getConfidence() <= 1.0;
    }

    private record Contribution(EvidenceRecord record, double weighted) {
    }
}
