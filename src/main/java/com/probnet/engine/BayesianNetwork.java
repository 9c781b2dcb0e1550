package com.probnet.engine;

import com.probnet.api.CycleDetectedException;
import com.probnet.api.DuplicateVariableException;
import com.probnet.api.InconsistentNetworkException;
import com.probnet.api.UnknownVariableException;
import com.probnet.node.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A Bayesian network: a set of {@link Variable}s plus directed parent to
 * child edges.
 *
 * <p>
 * Variables and edges are keyed by name, so lookups do not depend on object
 * identity. The network is built incrementally by a single writer (add
 * variables, then edges) and is treated as read-only once handed to an
 * {@link EnumerationEngine}.
 *
 * <p>
 * Declaring an edge does not by itself check that the child's table lists
 * the parent. Call {@link #checkConsistency()} once the network is complete;
 * the engine does so before caching its order.
 */
public final class BayesianNetwork {
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    /**
     * Registers a variable.
     *
     * @throws DuplicateVariableException if the name is already registered.
     */
    public BayesianNetwork addVariable(Variable variable) {
        if (variables.containsKey(variable.name()))
            throw new DuplicateVariableException(variable.name());
        variables.put(variable.name(), variable);
        edges.put(variable.name(), new LinkedHashSet<>());
        return this;
    }

    /**
     * Records that {@code child} directly depends on {@code parent}. Both must be
     * the instances registered under their names.
     *
     * @throws UnknownVariableException if either variable is not registered.
     */
    public BayesianNetwork addEdge(Variable parent, Variable child) {
        requireRegistered(parent);
        requireRegistered(child);
        return addEdge(parent.name(), child.name());
    }

    /** Name-based variant of {@link #addEdge(Variable, Variable)}. */
    public BayesianNetwork addEdge(String parent, String child) {
        variable(parent);
        variable(child);
        edges.get(parent).add(child);
        return this;
    }

    private void requireRegistered(Variable v) {
        if (variables.get(v.name()) != v)
            throw new UnknownVariableException(v.name());
    }

    /**
     * @throws UnknownVariableException if no variable has this name.
     */
    public Variable variable(String name) {
        Variable v = variables.get(name);
        if (v == null)
            throw new UnknownVariableException(name);
        return v;
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    /** Registered variables in insertion order. */
    public List<Variable> variables() {
        return List.copyOf(variables.values());
    }

    /** Direct children of the named variable, in the order the edges were added. */
    public Set<String> children(String name) {
        variable(name);
        return Collections.unmodifiableSet(edges.get(name));
    }

    /**
     * Verifies that edges and declared parents describe the same graph: every
     * parent a variable declares has an edge into it, every edge target declares
     * its source as a parent, and declared parent cardinalities match the
     * registered parents.
     *
     * @throws InconsistentNetworkException listing every mismatch found.
     */
    public void checkConsistency() {
        List<String> problems = new ArrayList<>();
        for (Variable child : variables.values()) {
            int[] declared = child.parentCardinalities();
            for (int i = 0; i < declared.length; i++) {
                String parentName = child.parents().get(i);
                Variable parent = variables.get(parentName);
                if (parent == null) {
                    problems.add(child.name() + " declares unknown parent " + parentName);
                    continue;
                }
                if (!edges.get(parentName).contains(child.name()))
                    problems.add("missing edge " + parentName + " -> " + child.name());
                if (parent.cardinality() != declared[i])
                    problems.add(child.name() + " expects " + declared[i] + " states for " + parentName
                            + " but it has " + parent.cardinality());
            }
        }
        for (var entry : edges.entrySet())
            for (String childName : entry.getValue())
                if (!variables.get(childName).parents().contains(entry.getKey()))
                    problems.add("edge " + entry.getKey() + " -> " + childName + " but " + childName
                            + " does not list " + entry.getKey() + " as a parent");
        if (!problems.isEmpty())
            throw new InconsistentNetworkException(problems);
    }

    /**
     * Sorts the variables so that every parent precedes its children, breaking
     * ties by name.
     *
     * @throws CycleDetectedException if the edges contain a cycle.
     */
    public TopologicalOrder topologicalOrder() {
        TopologicalOrder.Builder builder = TopologicalOrder.builder();
        for (Variable v : variables.values())
            builder.addVariable(v);
        for (var entry : edges.entrySet())
            for (String child : entry.getValue())
                builder.addEdge(entry.getKey(), child);
        return builder.build();
    }
}
