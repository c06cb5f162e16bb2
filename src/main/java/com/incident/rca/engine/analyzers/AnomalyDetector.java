package com.incident.rca.engine.analyzers;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.engine.Analyzer;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.exception.InputMalformedException;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.MetricSample;
import com.incident.rca.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Flags metric samples that sit far from the series mean.
 *
 * Logic: per metric, compute the mean and population standard deviation over all valid
 * samples, then flag every sample whose |z| = |value - mean| / std strictly exceeds the
 * configured threshold. Severity is critical at or above the critical threshold.
 *
 * Example: cpu = [0.2, 0.25, 0.9] gives mean 0.45, std 0.3189. The 0.9 sample has
 * z = 1.41, below the default threshold of 2.0, so nothing is flagged.
 *
 * Null, NaN and infinite values are skipped and do not count towards mean or std.
 * A series with fewer than two valid samples, or with all valid samples equal, has no
 * spread and is never flagged.
 */
@Component
public class AnomalyDetector implements Analyzer<Map<String, List<MetricSample>>> {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final AnalysisConfig config;

    public AnomalyDetector(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.METRICS;
    }

    @Override
    public void detect(Map<String, List<MetricSample>> metrics, Consumer<EvidenceRecord> sink) {
        if (metrics.containsKey(null)) {
            throw new InputMalformedException("Metric series with a null name");
        }

        double threshold = config.getAnomaly().getThreshold();
        double criticalThreshold = config.getAnomaly().getCriticalThreshold();

        // Name order keeps the output independent of the map implementation
        List<String> names = new ArrayList<>(metrics.keySet());
        names.sort(null);

        for (String name : names) {
            List<MetricSample> samples = metrics.get(name);
            if (samples == null) {
                throw new InputMalformedException("Metric '" + name + "' has no sample sequence");
            }
            scanSeries(name, samples, threshold, criticalThreshold, sink);
        }
    }

    private void scanSeries(String metric, List<MetricSample> samples, double threshold,
                            double criticalThreshold, Consumer<EvidenceRecord> sink) {
        List<MetricSample> valid = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            if (sample != null && isUsable(sample.getValue())) {
                valid.add(sample);
            }
        }
        if (valid.size() < 2) {
            log.debug("Metric '{}' has {} usable sample(s), skipping", metric, valid.size());
            return;
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (MetricSample sample : valid) {
            double v = sample.getValue();
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        // Constant series: rounding in the mean must not produce a tiny non-zero std
        if (min == max) {
            return;
        }

        double mean = sum / valid.size();
        double squares = 0;
        for (MetricSample sample : valid) {
            double d = sample.getValue() - mean;
            squares += d * d;
        }
        double stdDev = Math.sqrt(squares / valid.size());
        if (stdDev == 0.0) {
            return;
        }

        for (MetricSample sample : valid) {
            double z = (sample.getValue() - mean) / stdDev;
            double absZ = Math.abs(z);
            if (absZ > threshold) {
                sink.accept(anomaly(metric, sample, z, mean, stdDev, absZ >= criticalThreshold));
            }
        }
    }

    private EvidenceRecord anomaly(String metric, MetricSample sample, double z, double mean,
                                   double stdDev, boolean critical) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("metric", metric);
        attributes.put("timestamp", sample.getTimestamp());
        attributes.put("value", sample.getValue());
        attributes.put("z_score", z);
        attributes.put("mean", mean);
        attributes.put("std_dev", stdDev);

        String description = String.format(Locale.ROOT,
                "Metric '%s' value %.4f at %d deviates from mean %.4f (std %.4f), z=%.2f",
                metric, sample.getValue(), sample.getTimestamp(), mean, stdDev, z);

        return EvidenceRecord.builder()
                .source(EvidenceSource.METRICS)
                .kind(EvidenceKinds.METRIC_ANOMALY)
                .severity(critical ? Severity.CRITICAL : Severity.WARNING)
                .description(description)
                .attributes(attributes)
                .confidence(Math.max(0.0, Math.min(1.0, Math.abs(z) / 4.0)))
                .build();
    }

    private static boolean isUsable(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
