package com.incident.rca.controller;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.Severity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime analysis configuration (thresholds, reasoning, scoring)")
public class ConfigController {

    private final AnalysisConfig analysisConfig;

    public ConfigController(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    // ── Analysis ──

    @Operation(summary = "Get anomaly thresholds and reasoning settings")
    @GetMapping("/analysis")
    public ResponseEntity<Map<String, Object>> getAnalysis() {
        AnalysisConfig.Anomaly anomaly = analysisConfig.getAnomaly();
        AnalysisConfig.Reasoning reasoning = analysisConfig.getReasoning();
        return ResponseEntity.ok(Map.of(
                "threshold", anomaly.getThreshold(),
                "criticalThreshold", anomaly.getCriticalThreshold(),
                "reasoningEnabled", reasoning.isEnabled(),
                "enrichmentTimeoutMs", reasoning.getEnrichmentTimeoutMs(),
                "runDeadlineMs", reasoning.getRunDeadlineMs()
        ));
    }

    @Operation(summary = "Update anomaly thresholds and reasoning settings",
            description = "Changes apply to subsequent runs immediately but reset on restart. " +
                    "Enabling reasoning has no effect unless a reasoning backend is configured.")
    @PutMapping("/analysis")
    public ResponseEntity<?> updateAnalysis(@RequestBody Map<String, Object> body) {
        AnalysisConfig.Anomaly anomaly = analysisConfig.getAnomaly();
        AnalysisConfig.Reasoning reasoning = analysisConfig.getReasoning();

        double threshold = toDouble(body, "threshold", anomaly.getThreshold());
        double critical = toDouble(body, "criticalThreshold", anomaly.getCriticalThreshold());
        boolean enabled = toBoolean(body, "reasoningEnabled", reasoning.isEnabled());
        long timeoutMs = toLong(body, "enrichmentTimeoutMs", reasoning.getEnrichmentTimeoutMs());
        long deadlineMs = toLong(body, "runDeadlineMs", reasoning.getRunDeadlineMs());

        if (!Double.isFinite(threshold) || threshold <= 0) return badRequest("threshold must be > 0", "threshold");
        if (!Double.isFinite(critical) || critical < threshold)
            return badRequest("criticalThreshold must be >= threshold", "criticalThreshold");
        if (timeoutMs <= 0) return badRequest("enrichmentTimeoutMs must be > 0", "enrichmentTimeoutMs");
        if (deadlineMs <= 0) return badRequest("runDeadlineMs must be > 0", "runDeadlineMs");

        anomaly.setThreshold(threshold);
        anomaly.setCriticalThreshold(critical);
        reasoning.setEnabled(enabled);
        reasoning.setEnrichmentTimeoutMs(timeoutMs);
        reasoning.setRunDeadlineMs(deadlineMs);

        return getAnalysis();
    }

    // ── Scoring ──

    @Operation(summary = "Get correlation weights",
            description = "Source weights and severity multipliers used to score root-cause candidates.")
    @GetMapping("/scoring")
    public ResponseEntity<Map<String, Object>> getScoring() {
        AnalysisConfig.Scoring scoring = analysisConfig.getScoring();
        return ResponseEntity.ok(Map.of(
                "sourceWeights", scoring.getSourceWeights(),
                "severityMultipliers", scoring.getSeverityMultipliers(),
                "rationaleEvidenceCount", scoring.getRationaleEvidenceCount()
        ));
    }

    @Operation(summary = "Update correlation weights",
            description = "Partial updates are merged into the current weights. Values must be > 0. " +
                    "Changes apply immediately but reset on restart.")
    @PutMapping("/scoring")
    public ResponseEntity<?> updateScoring(@RequestBody Map<String, Object> body) {
        AnalysisConfig.Scoring scoring = analysisConfig.getScoring();

        Map<EvidenceSource, Double> weights = new EnumMap<>(scoring.getSourceWeights());
        if (body.get("sourceWeights") instanceof Map<?, ?> raw) {
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                EvidenceSource source = parseEnum(EvidenceSource.class, entry.getKey());
                if (source == null) return badRequest("Unknown source: " + entry.getKey(), "sourceWeights");
                Double value = toPositive(entry.getValue());
                if (value == null) return badRequest("sourceWeights values must be > 0", "sourceWeights");
                weights.put(source, value);
            }
        }

        Map<Severity, Double> multipliers = new EnumMap<>(scoring.getSeverityMultipliers());
        if (body.get("severityMultipliers") instanceof Map<?, ?> raw) {
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                Severity severity = parseEnum(Severity.class, entry.getKey());
                if (severity == null) return badRequest("Unknown severity: " + entry.getKey(), "severityMultipliers");
                Double value = toPositive(entry.getValue());
                if (value == null) return badRequest("severityMultipliers values must be > 0", "severityMultipliers");
                multipliers.put(severity, value);
            }
        }

        int count = (int) toLong(body, "rationaleEvidenceCount", scoring.getRationaleEvidenceCount());
        if (count <= 0) return badRequest("rationaleEvidenceCount must be > 0", "rationaleEvidenceCount");

        scoring.setSourceWeights(weights);
        scoring.setSeverityMultipliers(multipliers);
        scoring.setRationaleEvidenceCount(count);

        return getScoring();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("field", field);
        return ResponseEntity.badRequest().body(body);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, Object raw) {
        if (raw == null) return null;
        try { return Enum.valueOf(type, raw.toString().trim().toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return null; }
    }

    private static Double toPositive(Object v) {
        double value;
        if (v instanceof Number n) {
            value = n.doubleValue();
        } else {
            try { value = Double.parseDouble(String.valueOf(v)); } catch (NumberFormatException e) { return null; }
        }
        return value > 0 && !Double.isInfinite(value) ? value : null;
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
