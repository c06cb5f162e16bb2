package com.incident.rca.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;

import java.util.Optional;

/**
 * The backend's root-cause verdict: {@code {root_cause, confidence_score, explanation}}.
 */
@Value
public class RootCauseNarrative {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    String rootCause;

    Double confidenceScore;

    String explanation;

    /**
     * Extract the outermost JSON object from a raw response. Empty when there is no parsable
     * object or it lacks a non-blank explanation.
     */
    public static Optional<RootCauseNarrative> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(raw.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        String explanation = node.path("explanation").asText("");
        if (explanation.isBlank()) {
            return Optional.empty();
        }
        String rootCause = node.hasNonNull("root_cause") ? node.get("root_cause").asText() : null;
        Double confidence = node.path("confidence_score").isNumber()
                ? node.get("confidence_score").asDouble()
                : null;
        return Optional.of(new RootCauseNarrative(rootCause, confidence, explanation.strip()));
    }

    /** Rationale text attached to the top candidate. */
    public String toRationale() {
        if (rootCause == null || rootCause.isBlank()) {
            return explanation;
        }
        return rootCause + ": " + explanation;
    }
}
