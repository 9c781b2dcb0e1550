package com.probnet.api;

import java.util.Map;

/**
 * Thrown when the evidence of a query has zero probability under the network,
 * leaving the posterior undefined.
 */
public class ZeroProbabilityEvidenceException extends IllegalArgumentException {
    private final String queryVariable;
    private final Map<String, Integer> evidence;

    public ZeroProbabilityEvidenceException(String queryVariable, Map<String, Integer> evidence) {
        super("Evidence " + evidence + " has zero probability; posterior of '" + queryVariable + "' is undefined");
        this.queryVariable = queryVariable;
        this.evidence = Map.copyOf(evidence);
    }

    public String queryVariable() {
        return queryVariable;
    }

    public Map<String, Integer> evidence() {
        return evidence;
    }
}
