package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Human-readable postmortem derived from a pipeline run")
public class Postmortem {

    @Schema(example = "Postmortem: orders-db")
    String title;

    @Schema(description = "Suspected root cause component", example = "orders-db")
    String rootCause;

    @Schema(example = "0.8667")
    double confidence;

    @Schema(description = "Concrete follow-ups derived from the evidence")
    List<String> actionItems;

    @Schema(description = "Full Markdown document")
    String markdown;

    @Schema(description = "TEMPLATE or REASONING_BACKEND", example = "TEMPLATE")
    String generatedBy;
}
