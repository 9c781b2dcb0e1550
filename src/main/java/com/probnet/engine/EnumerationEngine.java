package com.probnet.engine;

import com.probnet.api.*;
import com.probnet.node.Variable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Exact inference over a {@link BayesianNetwork} by enumeration.
 *
 * Algorithm Details:
 * A query for variable X given evidence e runs "enumeration-ask":
 *
 * 1. Pin: for every state x of X, extend the evidence with X = x. The query
 * value overrides any value the caller supplied for X.
 *
 * 2. Enumerate: sum the joint probability over all assignments of the
 * remaining unobserved variables ("enumerate-all"). The recursion consumes
 * the cached topological order from the front, so when a variable is reached
 * every one of its parents already has a value, either observed, pinned, or
 * assigned by an enclosing call.
 *
 * 3. Normalize: divide the per-state weights by their sum.
 *
 * Each branch of a summation receives its own copy of the evidence map, so
 * sibling branches never share mutable state and a finalized engine can be
 * queried from several threads at once.
 *
 * Cost:
 * Time is exponential in the number of unobserved variables. An optional
 * evaluation budget (number of table lookups per query) turns a runaway query
 * into an {@link InferenceBudgetExceededException}.
 *
 * Precondition:
 * The network must not be mutated after the engine is built. The order is
 * computed once in the constructor; later edits would silently invalidate it.
 */
public final class EnumerationEngine {
    private static final Logger log = LogManager.getLogger(EnumerationEngine.class);

    private final BayesianNetwork network;
    private final TopologicalOrder topology;
    // Cached copy of the topological order for index-based recursion.
    private final Variable[] order;
    private final long maxEvaluations;

    private volatile InferenceListener listener;

    public EnumerationEngine(BayesianNetwork network) {
        this(network, 0);
    }

    /**
     * @param maxEvaluations upper bound on table lookups per query; 0 disables
     *                       the bound.
     * @throws CycleDetectedException       if the network contains a cycle.
     * @throws InconsistentNetworkException if edges and declared parents
     *                                      disagree.
     */
    public EnumerationEngine(BayesianNetwork network, long maxEvaluations) {
        if (maxEvaluations < 0)
            throw new IllegalArgumentException("maxEvaluations must be >= 0, got " + maxEvaluations);
        this.network = network;
        this.topology = network.topologicalOrder();
        network.checkConsistency();
        this.order = topology.variables().toArray(new Variable[0]);
        this.maxEvaluations = maxEvaluations;
        log.debug("Engine ready: {} variables, structure {}", order.length, topology);
    }

    public void setListener(InferenceListener listener) {
        this.listener = listener;
    }

    public TopologicalOrder topology() {
        return topology;
    }

    public BayesianNetwork network() {
        return network;
    }

    public long maxEvaluations() {
        return maxEvaluations;
    }

    /** Posterior of the variable without evidence, i.e. its marginal. */
    public Posterior query(String variableName) {
        return query(variableName, Collections.emptyMap());
    }

    /**
     * Computes P(variableName | evidence).
     *
     * @throws UnknownVariableException          if the query variable or an
     *                                           evidence key is not in the
     *                                           network.
     * @throws InvalidStateException             if an evidence value is out of
     *                                           range.
     * @throws ZeroProbabilityEvidenceException  if the evidence is impossible.
     * @throws InferenceBudgetExceededException  if the evaluation budget runs
     *                                           out.
     */
    public Posterior query(String variableName, Map<String, Integer> evidence) {
        final InferenceListener l = this.listener;
        final Map<String, Integer> observed = Collections.unmodifiableMap(new HashMap<>(evidence));
        if (l != null)
            l.onQueryStart(variableName, observed);
        long start = System.nanoTime();
        try {
            Variable x = network.variable(variableName);
            validateEvidence(observed);

            Budget budget = new Budget(variableName, maxEvaluations);
            double[] weights = new double[x.cardinality()];
            for (int state = 0; state < weights.length; state++) {
                Map<String, Integer> pinned = new HashMap<>(observed);
                pinned.put(variableName, state);
                weights[state] = enumerateAll(0, pinned, budget);
            }
            Posterior posterior = new Posterior(variableName, observed, normalize(variableName, observed, weights));

            long duration = System.nanoTime() - start;
            if (l != null)
                l.onQueryEnd(variableName, budget.used, duration);
            log.debug("{} ({} evaluations, {} us)", posterior, budget.used, duration / 1000);
            return posterior;
        } catch (RuntimeException e) {
            if (l != null)
                l.onQueryError(variableName, e);
            throw e;
        }
    }

    /**
     * Probability of the (possibly partial) assignment under the network, with
     * every variable it leaves out summed over. Unnormalized; an empty
     * assignment has probability 1.
     */
    public double joint(Map<String, Integer> assignment) {
        validateEvidence(assignment);
        return enumerateAll(0, new HashMap<>(assignment), new Budget("<joint>", maxEvaluations));
    }

    private void validateEvidence(Map<String, Integer> evidence) {
        for (var entry : evidence.entrySet()) {
            Variable v = network.variable(entry.getKey());
            Integer state = entry.getValue();
            if (state == null)
                throw new InvalidStateException(v.name(), -1, v.cardinality());
            if (state < 0 || state >= v.cardinality())
                throw new InvalidStateException(v.name(), state, v.cardinality());
        }
    }

    /**
     * enumerate-all over order[index..]. The head variable is the earliest one
     * not yet consumed.
     */
    private double enumerateAll(int index, Map<String, Integer> evidence, Budget budget) {
        if (index == order.length)
            return 1.0;

        Variable y = order[index];
        Integer observed = evidence.get(y.name());
        if (observed != null) {
            budget.charge();
            double p = y.probability(observed, evidence);
            // Zero short-circuits the rest of the chain; nothing below can revive it.
            return p == 0.0 ? 0.0 : p * enumerateAll(index + 1, evidence, budget);
        }

        double sum = 0.0;
        for (int state = 0; state < y.cardinality(); state++) {
            budget.charge();
            double p = y.probability(state, evidence);
            if (p == 0.0)
                continue;
            Map<String, Integer> extended = new HashMap<>(evidence);
            extended.put(y.name(), state);
            sum += p * enumerateAll(index + 1, extended, budget);
        }
        return sum;
    }

    private static double[] normalize(String variableName, Map<String, Integer> evidence, double[] weights) {
        double z = 0.0;
        for (double w : weights)
            z += w;
        if (z == 0.0)
            throw new ZeroProbabilityEvidenceException(variableName, evidence);
        double[] out = new double[weights.length];
        for (int i = 0; i < weights.length; i++)
            out[i] = weights[i] / z;
        return out;
    }

    /** Per-query lookup counter. Lives on the querying thread only. */
    private static final class Budget {
        private final String queryVariable;
        private final long limit;
        private long used;

        Budget(String queryVariable, long limit) {
            this.queryVariable = queryVariable;
            this.limit = limit;
        }

        void charge() {
            if (++used > limit && limit > 0)
                throw new InferenceBudgetExceededException(queryVariable, limit);
        }
    }
}
