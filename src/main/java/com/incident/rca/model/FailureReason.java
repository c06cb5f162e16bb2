package com.incident.rca.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Why an analyzer, backend call or run did not fully succeed")
public class FailureReason {

    @Schema(description = "Failure category", example = "INPUT_MALFORMED")
    FailureType type;

    @Schema(description = "Detail message", example = "Metric 'cpu' has no sample sequence")
    String message;

    public static FailureReason of(FailureType type, String message) {
        return new FailureReason(type, message);
    }
}
