package com.incident.rca.reasoning;

import com.incident.rca.model.FailureReason;
import com.incident.rca.model.FailureType;

/**
 * Settled backend call: either response text or the reason there is none.
 */
public record ReasoningOutcome(String purpose, String text, FailureReason failure) {

    public static ReasoningOutcome success(String purpose, String text) {
        return new ReasoningOutcome(purpose, text, null);
    }

    public static ReasoningOutcome failed(String purpose, FailureType type, String message) {
        return new ReasoningOutcome(purpose, null, FailureReason.of(type, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** Unreachable, failed or timed out; the run is degraded. */
    public boolean isUnavailable() {
        return failure != null && failure.getType() == FailureType.BACKEND_UNAVAILABLE;
    }
}
