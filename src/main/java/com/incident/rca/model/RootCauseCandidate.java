package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

@Value
@Builder
@Schema(description = "One ranked candidate failing component")
public class RootCauseCandidate {

    @Schema(description = "Affected component (service graph node name, or 'unknown')", example = "orders-db")
    String component;

    @Schema(description = "Normalized aggregate confidence (0-1)", example = "0.8667")
    double score;

    @Schema(description = "Highest-priority source among contributing evidence", example = "DESIGN")
    EvidenceSource topSource;

    @Schema(description = "Contributing evidence, strongest contribution first")
    List<EvidenceRecord> evidence;

    @With
    @Schema(description = "Why this component is suspected")
    String rationale;
}
