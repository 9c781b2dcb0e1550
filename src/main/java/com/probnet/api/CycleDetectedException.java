package com.probnet.api;

import java.util.List;

/**
 * Thrown by the topological sort when the edge relation contains a cycle.
 * A network with a cycle can never be queried.
 */
public class CycleDetectedException extends IllegalStateException {
    private final List<String> unresolved;

    public CycleDetectedException(int processed, int total, List<String> unresolved) {
        super("Cycle detected! Processed " + processed + " of " + total + ", unresolved: " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /** Names of the variables that never reached in-degree zero, sorted. */
    public List<String> unresolved() {
        return unresolved;
    }
}
