package com.incident.rca.reasoning;

import com.incident.rca.exception.ReasoningBackendException;

import java.util.Map;

/**
 * Boundary to a generative-text service. Used only to enrich evidence and to write
 * narratives; no deterministic finding depends on it.
 *
 * Calls may block. Callers bound them in time and may invoke this any number of times,
 * concurrently and in any order.
 */
public interface ReasoningBackend {

    /**
     * @param prompt  task instructions
     * @param context structured data the prompt refers to (JSON-serializable)
     * @return the raw response text, possibly blank
     * @throws ReasoningBackendException when the backend is unreachable or refuses the call
     */
    String complete(String prompt, Map<String, Object> context) throws ReasoningBackendException;
}
