package com.incident.rca.service;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.model.AnalyzerResult;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureReason;
import com.incident.rca.model.InputSummary;
import com.incident.rca.model.PipelineRun;
import com.incident.rca.model.Postmortem;
import com.incident.rca.model.RootCauseCandidate;
import com.incident.rca.model.RunStatus;
import com.incident.rca.model.Severity;
import com.incident.rca.reasoning.BoundedReasoningClient;
import com.incident.rca.reasoning.ReasoningOutcome;
import com.incident.rca.reasoning.ReasoningPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Turns a frozen {@link PipelineRun} into a Markdown postmortem.
 *
 * The template draft is always built. When the reasoning backend is available it is asked to
 * polish the draft under the usual time bound; any failure keeps the template.
 */
@Service
public class PostmortemService {

    private static final Logger log = LoggerFactory.getLogger(PostmortemService.class);

    static final String GENERATED_BY_TEMPLATE = "TEMPLATE";
    static final String GENERATED_BY_BACKEND = "REASONING_BACKEND";

    private static final int MAX_EVIDENCE_LINES = 10;
    private static final int MAX_TIMELINE_LINES = 20;
    private static final int MAX_OTHER_CANDIDATES = 4;

    private final BoundedReasoningClient reasoningClient;
    private final AnalysisConfig config;

    public PostmortemService(BoundedReasoningClient reasoningClient, AnalysisConfig config) {
        this.reasoningClient = reasoningClient;
        this.config = config;
    }

    public Postmortem compose(PipelineRun run) {
        Optional<RootCauseCandidate> top = run.getHypothesis().top();
        String rootCause = top.map(RootCauseCandidate::getComponent).orElse("unknown");
        double confidence = top.map(RootCauseCandidate::getScore).orElse(0.0);
        String title = top.isPresent() ? "Postmortem: " + rootCause : "Postmortem: root cause undetermined";

        List<String> actionItems = actionItems(run);
        String markdown = draft(run, title, actionItems);
        String generatedBy = GENERATED_BY_TEMPLATE;

        if (run.getStatus() != RunStatus.FAILED && reasoningClient.isAvailable()) {
            Optional<String> polished = polish(run, markdown, rootCause, confidence, actionItems);
            if (polished.isPresent()) {
                markdown = polished.get();
                generatedBy = GENERATED_BY_BACKEND;
            }
        }

        log.info("Postmortem for run {} composed by {} ({} action item(s))",
                run.getRunId(), generatedBy, actionItems.size());
        return Postmortem.builder()
                .title(title)
                .rootCause(rootCause)
                .confidence(confidence)
                .actionItems(actionItems)
                .markdown(markdown)
                .generatedBy(generatedBy)
                .build();
    }

    /**
     * Concrete follow-ups: one per structural finding, one for the top candidate when it is
     * not a design finding, one per failed analyzer.
     */
    List<String> actionItems(PipelineRun run) {
        Set<String> items = new LinkedHashSet<>();
        if (run.getDesignResult() != null) {
            for (EvidenceRecord record : run.getDesignResult().getEvidence()) {
                String item = designActionItem(record);
                if (item != null) {
                    items.add(item);
                }
            }
        }

        run.getHypothesis().top().ifPresent(candidate -> {
            if (candidate.getTopSource() != EvidenceSource.DESIGN && !candidate.getEvidence().isEmpty()) {
                items.add(String.format(Locale.ROOT, "Investigate %s: %s",
                        candidate.getComponent(), candidate.getEvidence().get(0).getDescription()));
            }
        });

        for (AnalyzerResult result : run.analyzerResults()) {
            if (result.isFailed()) {
                items.add(String.format(Locale.ROOT, "Fix %s input and re-run analysis (%s: %s)",
                        result.getSource().name().toLowerCase(Locale.ROOT),
                        result.getFailure().getType(), result.getFailure().getMessage()));
            }
        }
        return new ArrayList<>(items);
    }

    private static String designActionItem(EvidenceRecord record) {
        String node = record.stringAttribute("node");
        String rule = record.stringAttribute("rule");
        if (rule == null) {
            return null;
        }
        return switch (rule) {
            case "single_replica" -> "Increase replicas of " + node + " to at least 2";
            case "stateful_no_read_replicas" -> "Add read replicas to " + node + " to spread read load";
            case "cross_zone" -> "Distribute " + node + " across at least 2 zones or co-locate it with its callers ("
                    + record.stringAttribute("callers") + ")";
            case "sync_cycle" -> "Break the synchronous call cycle among [" + record.stringAttribute("members")
                    + "] with async messaging or a circuit breaker";
            default -> null;
        };
    }

    String draft(PipelineRun run, String title, List<String> actionItems) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(title).append("\n\n");
        md.append("Run `").append(run.getRunId()).append("` · status **").append(run.getStatus()).append("**");
        if (run.getCompletedAt() != null) {
            md.append(" · completed ").append(run.getCompletedAt());
        }
        md.append("\n\n");

        md.append("## What Happened\n\n");
        InputSummary inputs = run.getInputs();
        String description = inputs == null ? null : inputs.getDescription();
        md.append(description == null || description.isBlank()
                ? "No incident description was provided." : description.strip()).append("\n\n");
        if (inputs != null) {
            md.append("Inputs analyzed: ").append(describeInputs(inputs)).append(".\n\n");
        }

        md.append("## Impact\n\n");
        appendImpact(md, run);

        md.append("## Root Cause\n\n");
        appendRootCause(md, run);

        md.append("## Evidence\n\n");
        appendEvidence(md, run);

        md.append("## Timeline\n\n");
        appendTimeline(md, run);

        md.append("## Action Items\n\n");
        if (actionItems.isEmpty()) {
            md.append("No concrete action items were derived; review the evidence above.\n");
        } else {
            actionItems.forEach(item -> md.append("- [ ] ").append(item).append('\n'));
        }
        return md.toString();
    }

    private static String describeInputs(InputSummary inputs) {
        List<String> parts = new ArrayList<>();
        if (inputs.getLogLength() >= 0) {
            parts.add("logs (" + inputs.getLogLength() + " chars)");
        }
        if (!inputs.getMetricNames().isEmpty()) {
            parts.add("metrics " + inputs.getMetricNames());
        }
        if (!inputs.getNodeNames().isEmpty()) {
            parts.add("service graph (" + inputs.getNodeNames().size() + " nodes, "
                    + inputs.getConnectionCount() + " connections)");
        }
        return parts.isEmpty() ? "none" : String.join(", ", parts);
    }

    private static void appendImpact(StringBuilder md, PipelineRun run) {
        Map<Severity, Integer> counts = new LinkedHashMap<>();
        counts.put(Severity.CRITICAL, 0);
        counts.put(Severity.WARNING, 0);
        counts.put(Severity.INFO, 0);
        for (EvidenceRecord record : run.allEvidence()) {
            if (!EvidenceKinds.isSummary(record.getKind()) && record.getSource() != EvidenceSource.REASONING) {
                counts.merge(record.getSeverity(), 1, Integer::sum);
            }
        }
        md.append(String.format(Locale.ROOT, "- Findings: %d critical, %d warning, %d info\n",
                counts.get(Severity.CRITICAL), counts.get(Severity.WARNING), counts.get(Severity.INFO)));

        List<String> components = run.getHypothesis().getCandidates().stream()
                .map(RootCauseCandidate::getComponent)
                .filter(component -> !RootCauseCorrelationService.UNKNOWN_COMPONENT.equals(component))
                .toList();
        md.append("- Affected components: ")
                .append(components.isEmpty() ? "none identified" : String.join(", ", components))
                .append('\n');

        for (AnalyzerResult result : run.analyzerResults()) {
            if (result.isFailed()) {
                md.append("- ").append(result.getSource()).append(" analysis incomplete: ")
                        .append(result.getFailure().getMessage()).append('\n');
            }
        }
        for (FailureReason degradation : run.getDegradations()) {
            md.append("- Reasoning degraded: ").append(degradation.getMessage()).append('\n');
        }
        md.append('\n');
    }

    private static void appendRootCause(StringBuilder md, PipelineRun run) {
        Optional<RootCauseCandidate> top = run.getHypothesis().top();
        if (top.isEmpty()) {
            FailureReason reason = run.getHypothesis().getFailureReason();
            md.append("Undetermined")
                    .append(reason != null ? ": " + reason.getMessage() : "")
                    .append(".\n\n");
            return;
        }

        RootCauseCandidate candidate = top.get();
        md.append(String.format(Locale.ROOT, "**%s** (confidence %.4f, strongest source %s)\n\n",
                candidate.getComponent(), candidate.getScore(), candidate.getTopSource()));
        md.append(candidate.getRationale()).append("\n\n");

        List<RootCauseCandidate> others = run.getHypothesis().getCandidates().stream()
                .skip(1)
                .limit(MAX_OTHER_CANDIDATES)
                .toList();
        if (!others.isEmpty()) {
            md.append("Other candidates:\n\n");
            others.forEach(other -> md.append(String.format(Locale.ROOT, "- %s (%.4f)\n",
                    other.getComponent(), other.getScore())));
            md.append('\n');
        }
    }

    private static void appendEvidence(StringBuilder md, PipelineRun run) {
        List<EvidenceRecord> evidence = run.getHypothesis().top()
                .map(RootCauseCandidate::getEvidence)
                .orElse(List.of());
        if (evidence.isEmpty()) {
            md.append("No supporting evidence.\n\n");
            return;
        }
        evidence.stream().limit(MAX_EVIDENCE_LINES).forEach(record -> md.append(String.format(Locale.ROOT,
                "- [%s] %s `%s`: %s\n", record.getSeverity(), record.getSource(), record.getKind(),
                record.getDescription())));
        if (evidence.size() > MAX_EVIDENCE_LINES) {
            md.append("- ... ").append(evidence.size() - MAX_EVIDENCE_LINES).append(" more\n");
        }
        md.append('\n');
    }

    /** Metric anomalies by timestamp, then log findings by line. */
    private static void appendTimeline(StringBuilder md, PipelineRun run) {
        List<String> events = new ArrayList<>();
        if (run.getMetricsResult() != null) {
            run.getMetricsResult().getEvidence().stream()
                    .filter(record -> record.attribute("timestamp") instanceof Number)
                    .sorted(Comparator.comparingLong(record -> ((Number) record.attribute("timestamp")).longValue()))
                    .forEach(record -> events.add("t=" + record.attribute("timestamp") + " " + record.getDescription()));
        }
        if (run.getLogResult() != null) {
            for (EvidenceRecord record : run.getLogResult().getEvidence()) {
                if (!EvidenceKinds.isSummary(record.getKind()) && record.getSeverity() == Severity.CRITICAL) {
                    events.add(record.getDescription());
                }
            }
        }

        if (events.isEmpty()) {
            md.append("No timestamped events were found.\n\n");
            return;
        }
        events.stream().limit(MAX_TIMELINE_LINES).forEach(event -> md.append("- ").append(event).append('\n'));
        md.append('\n');
    }

    private Optional<String> polish(PipelineRun run, String draft, String rootCause, double confidence,
                                    List<String> actionItems) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("draft", draft);
        context.put("root_cause", rootCause);
        context.put("confidence", confidence);
        context.put("action_items", actionItems);
        context.put("status", run.getStatus().name());

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getReasoning().getRunDeadlineMs());
        ReasoningOutcome outcome = reasoningClient.call("postmortem", ReasoningPrompts.POSTMORTEM, context, deadline);
        if (!outcome.isSuccess()) {
            return Optional.empty();
        }
        String text = stripFence(outcome.text().strip());
        if (!text.startsWith("#")) {
            reasoningClient.rejectMalformed(outcome, "Response is not a Markdown document");
            return Optional.empty();
        }
        return Optional.of(text);
    }

    /** Models often wrap Markdown in a ```markdown fence. */
    static String stripFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).strip();
    }
}
