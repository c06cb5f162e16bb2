package com.incident.rca.config;

import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "rca")
public class AnalysisConfig {

    private Anomaly anomaly = new Anomaly();

    private Reasoning reasoning = new Reasoning();

    private Pipeline pipeline = new Pipeline();

    private Scoring scoring = new Scoring();

    @Data
    public static class Anomaly {
        // A sample is flagged when |z| strictly exceeds this
        private double threshold = 2.0;

        // |z| at or above this makes the finding critical
        private double criticalThreshold = 3.0;
    }

    @Data
    public static class Reasoning {
        // Master switch for the generative backend; the deterministic core never needs it
        private boolean enabled = false;

        // Bound on each individual backend call
        private long enrichmentTimeoutMs = 10_000;

        // Bound on all backend calls of one run, measured from run start
        private long runDeadlineMs = 30_000;
    }

    @Data
    public static class Pipeline {
        // Analyzer tasks plus concurrent backend calls
        private int workerThreads = 8;
    }

    @Data
    public static class Scoring {
        private Map<EvidenceSource, Double> sourceWeights = defaultSourceWeights();

        private Map<Severity, Double> severityMultipliers = defaultSeverityMultipliers();

        // Descriptions listed in the deterministic rationale
        private int rationaleEvidenceCount = 3;

        public double weightOf(EvidenceSource source) {
            return sourceWeights.getOrDefault(source, 0.0);
        }

        public double multiplierOf(Severity severity) {
            return severityMultipliers.getOrDefault(severity, 0.0);
        }

        public double maxWeight() {
            return sourceWeights.values().stream().mapToDouble(Double::doubleValue).max().orElse(1.0);
        }

        public double maxMultiplier() {
            return severityMultipliers.values().stream().mapToDouble(Double::doubleValue).max().orElse(1.0);
        }

        private static Map<EvidenceSource, Double> defaultSourceWeights() {
            Map<EvidenceSource, Double> weights = new EnumMap<>(EvidenceSource.class);
            weights.put(EvidenceSource.DESIGN, 1.0);
            weights.put(EvidenceSource.METRICS, 0.9);
            weights.put(EvidenceSource.LOG, 0.8);
            weights.put(EvidenceSource.REASONING, 0.5);
            return weights;
        }

        private static Map<Severity, Double> defaultSeverityMultipliers() {
            Map<Severity, Double> multipliers = new EnumMap<>(Severity.class);
            multipliers.put(Severity.CRITICAL, 1.5);
            multipliers.put(Severity.WARNING, 1.0);
            multipliers.put(Severity.INFO, 0.5);
            return multipliers;
        }
    }
}
