package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** References to the inputs of one run, without copying the raw payloads. */
@Value
@Builder
@Schema(description = "What the run was given")
public class InputSummary {

    @Schema(example = "Checkout returning 500s after deploy abc123")
    String description;

    @Schema(description = "Length of the log text in characters, -1 when absent", example = "48213")
    long logLength;

    @Schema(description = "Metric names supplied, sorted")
    List<String> metricNames;

    @Schema(description = "Service graph node names")
    List<String> nodeNames;

    @Schema(example = "7")
    int connectionCount;

    public static InputSummary of(IncidentRequest request) {
        ServiceGraph design = request.getDesign();
        return InputSummary.builder()
                .description(request.getDescription())
                .logLength(request.hasLogs() ? request.getLogs().length() : -1)
                .metricNames(request.hasMetrics()
                        ? request.getMetrics().keySet().stream()
                                .filter(name -> name != null)
                                .sorted()
                                .toList()
                        : List.of())
                .nodeNames(design != null ? design.nodeNames() : List.of())
                .connectionCount(design != null && design.getConnections() != null
                        ? design.getConnections().size() : 0)
                .build();
    }
}
