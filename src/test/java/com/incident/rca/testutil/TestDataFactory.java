package com.incident.rca.testutil;

import com.incident.rca.config.AnalysisConfig;
import com.incident.rca.model.*;
import com.incident.rca.model.ServiceGraph.ServiceConnection;
import com.incident.rca.model.ServiceGraph.ServiceNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    public static AnalysisConfig defaultConfig() {
        return new AnalysisConfig();
    }

    public static List<MetricSample> series(double... values) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(MetricSample.of(i + 1, values[i]));
        }
        return samples;
    }

    public static Map<String, List<MetricSample>> metrics(String name, double... values) {
        Map<String, List<MetricSample>> metrics = new LinkedHashMap<>();
        metrics.put(name, series(values));
        return metrics;
    }

    public static ServiceNode node(String name, String type, Integer replicas) {
        return ServiceNode.builder()
                .name(name)
                .type(type)
                .replicas(replicas)
                .build();
    }

    public static ServiceConnection sync(String from, String to) {
        return ServiceConnection.builder().from(from).to(to).mode(ConnectionMode.SYNC).build();
    }

    public static ServiceConnection async(String from, String to) {
        return ServiceConnection.builder().from(from).to(to).mode(ConnectionMode.ASYNC).build();
    }

    public static ServiceGraph graph(List<ServiceNode> nodes, List<ServiceConnection> connections) {
        return ServiceGraph.builder()
                .nodes(new ArrayList<>(nodes))
                .connections(new ArrayList<>(connections))
                .build();
    }

    /** api (3 replicas) -> orders-db (1 replica, stateful), sync. */
    public static ServiceGraph apiAndDatabase() {
        return graph(
                List.of(node("api", "service", 3),
                        ServiceNode.builder().name("orders-db").type("db").replicas(1)
                                .stateful(true).readReplicas(0).build()),
                List.of(sync("api", "orders-db")));
    }

    public static EvidenceRecord createEvidence(EvidenceSource source, String kind, Severity severity,
                                                double confidence, Map<String, Object> attributes) {
        return EvidenceRecord.builder()
                .source(source)
                .kind(kind)
                .severity(severity)
                .description(source + " " + kind + " " + attributes)
                .attributes(attributes)
                .confidence(confidence)
                .build();
    }

    public static EvidenceRecord createEvidence(EvidenceSource source, Severity severity, String node) {
        return createEvidence(source, "finding", severity, 1.0, Map.of("node", node));
    }

    public static AnalyzerResult successResult(EvidenceSource source, EvidenceRecord... evidence) {
        return AnalyzerResult.success(source, List.of(evidence), 1);
    }

    public static AnalyzerResult failedResult(EvidenceSource source, FailureType type, EvidenceRecord... partial) {
        return AnalyzerResult.failure(source, List.of(partial), FailureReason.of(type, "boom"), 1);
    }

    public static IncidentRequest fullRequest() {
        return IncidentRequest.builder()
                .description("Checkout returning 500s")
                .logs("2024-01-01 ERROR orders-db connection refused\n")
                .metrics(metrics("orders-db.latency", 10, 11, 10, 12, 11, 10, 95))
                .design(apiAndDatabase())
                .build();
    }
}
