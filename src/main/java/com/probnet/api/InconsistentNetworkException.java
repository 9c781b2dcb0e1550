package com.probnet.api;

import java.util.List;

/**
 * Thrown when a network's edges disagree with the parents declared by its
 * variables' probability tables.
 */
public class InconsistentNetworkException extends IllegalStateException {
    private final List<String> problems;

    public InconsistentNetworkException(List<String> problems) {
        super("Inconsistent network: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
