package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One discrete structured finding produced by an analyzer.
 *
 * Immutable: the attribute map is copied on construction and exposed read-only.
 * For the deterministic analyzers, {@code source + kind + attributes} fully determine
 * the description.
 */
@Value
@Schema(description = "A single structured finding emitted by an analyzer")
public class EvidenceRecord {

    @Schema(description = "Analyzer that produced the finding", example = "METRICS")
    EvidenceSource source;

    @Schema(description = "Finding category", example = "metric_anomaly")
    String kind;

    @Schema(description = "Finding severity", example = "CRITICAL")
    Severity severity;

    @Schema(description = "Human-readable explanation",
            example = "Metric 'db-latency' value 950.0000 at 1700000300 deviates from mean 210.0000 (std 180.0000), z=4.11")
    String description;

    @Schema(description = "Analyzer-specific scalar attributes (counts, z-scores, node names)")
    Map<String, Object> attributes;

    @Schema(description = "Analyzer's own certainty in this finding (0-1)", example = "1.0")
    double confidence;

    @Builder
    private EvidenceRecord(EvidenceSource source, String kind, Severity severity, String description,
                           Map<String, Object> attributes, double confidence) {
        this.source = source;
        this.kind = kind;
        this.severity = severity;
        this.description = description;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.confidence = confidence;
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }
}
