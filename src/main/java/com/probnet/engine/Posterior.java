package com.probnet.engine;

import com.probnet.node.Variable;

import java.util.Arrays;
import java.util.Map;

/**
 * Normalized distribution of a query variable given evidence, indexed by the
 * variable's state indices.
 */
public final class Posterior {
    private final String variableName;
    private final Map<String, Integer> evidence;
    private final double[] probabilities;

    Posterior(String variableName, Map<String, Integer> evidence, double[] probabilities) {
        this.variableName = variableName;
        this.evidence = Map.copyOf(evidence);
        this.probabilities = probabilities;
    }

    public String variableName() {
        return variableName;
    }

    /** The evidence this posterior is conditioned on. */
    public Map<String, Integer> evidence() {
        return evidence;
    }

    public int cardinality() {
        return probabilities.length;
    }

    public double probability(int state) {
        return probabilities[state];
    }

    public double[] probabilities() {
        return probabilities.clone();
    }

    /** Index of the most probable state; the lowest index wins ties. */
    public int mostLikelyState() {
        int best = 0;
        for (int i = 1; i < probabilities.length; i++)
            if (probabilities[i] > probabilities[best])
                best = i;
        return best;
    }

    /**
     * Wraps the posterior as a parentless variable of the same name, so it can
     * be formatted or reused as a prior.
     */
    public Variable toVariable() {
        return Variable.prior(variableName, probabilities);
    }

    @Override
    public String toString() {
        return "P(" + variableName + (evidence.isEmpty() ? "" : " | " + evidence) + ") = "
                + Arrays.toString(probabilities);
    }
}
