package com.incident.rca.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String status, int candidateCount) {
        Counter.builder("pipeline.run.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("pipeline.run.candidates")
                .tag("status", status)
                .register(registry)
                .record(candidateCount);
    }

    public void recordEvidence(String source, int count) {
        DistributionSummary.builder("evidence.produced")
                .tag("source", source)
                .register(registry)
                .record(count);
    }

    public void recordAnalyzerFailure(String source, String failureType) {
        Counter.builder("analyzer.failure.count")
                .tag("source", source)
                .tag("type", failureType)
                .register(registry)
                .increment();
    }

    public void recordReasoningCall(String purpose, String outcome) {
        Counter.builder("reasoning.call.count")
                .tag("purpose", purpose)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
