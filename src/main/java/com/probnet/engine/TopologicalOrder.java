package com.probnet.engine;

import com.probnet.api.CycleDetectedException;
import com.probnet.api.DuplicateVariableException;
import com.probnet.api.UnknownVariableException;
import com.probnet.node.Variable;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded static DAG of a Bayesian network.
 *
 * This class represents the immutable, sorted structure of a network. The
 * enumeration engine walks it front to back, which guarantees that every
 * variable's parents have been assigned before the variable itself is
 * reached.
 *
 * Data layout:
 * - topoOrder: the variables sorted topologically. Iterating 0..N visits
 * parents before children.
 * - childrenList: a single flattened int array containing the topological
 * indices of all children for all variables.
 * - childrenOffset: childrenOffset[i] points to the start of variable i's
 * children in childrenList; they run up to childrenOffset[i+1] exclusive.
 *
 * Determinism:
 * When several variables are ready at once (in-degree zero), the one with
 * the lexicographically smallest name is emitted first. The resulting order
 * depends only on the set of variables and edges, never on insertion or hash
 * iteration order.
 */
@Log4j2
public final class TopologicalOrder {
    // The variables in topological order.
    private final Variable[] topoOrder;

    // CSR Index: childrenOffset[i] points to the start of variable i's children.
    private final int[] childrenOffset;

    // CSR Data: Flattened list of child indices.
    private final int[] childrenList;

    private final int[] parentCount;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Variable[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the variable at the given topological index. */
    public Variable node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a variable name to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new UnknownVariableException(name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** The variables in topological order, as an unmodifiable list. */
    public List<Variable> variables() {
        return List.of(topoOrder);
    }

    /** The variable names in topological order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(topoOrder.length);
        for (Variable v : topoOrder)
            names.add(v.name());
        return names;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Renders the structure in topological order, e.g. {@code A -> [B], B -> [C, D], C, D}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int ti = 0; ti < topoOrder.length; ti++) {
            if (ti > 0)
                sb.append(", ");
            sb.append(topoOrder[ti].name());
            int children = childCount(ti);
            if (children == 0)
                continue;
            sb.append(" -> [");
            for (int i = 0; i < children; i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(topoOrder[child(ti, i)].name());
            }
            sb.append(']');
        }
        return sb.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Variable> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, Set<Integer>> forwardEdges = new HashMap<>();

        public Builder addVariable(Variable variable) {
            if (nameToIdx.containsKey(variable.name()))
                throw new DuplicateVariableException(variable.name());
            int idx = nodes.size();
            nodes.add(variable);
            nameToIdx.put(variable.name(), idx);
            forwardEdges.put(idx, new LinkedHashSet<>());
            return this;
        }

        /**
         * Adds the edge {@code from -> to}. Repeated edges are recorded once. A
         * self edge is accepted here and reported as a cycle by {@link #build()}.
         */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new UnknownVariableException(name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm with a lexicographic tie-break and detects
         * cycles.
         *
         * @throws CycleDetectedException if some variables never reach in-degree
         *                                zero.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Ready set ordered by name
            PriorityQueue<Integer> ready = new PriorityQueue<>(Math.max(1, n),
                    Comparator.comparing(i -> nodes.get(i).name()));
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n) {
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        unresolved.add(nodes.get(i).name());
                Collections.sort(unresolved);
                throw new CycleDetectedException(topoIdx, n, unresolved);
            }

            // 4. Construct compact arrays
            Variable[] ordered = new Variable[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti].name(), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                int pos = offsets[ti];
                for (int child : forwardEdges.get(reverseMap[ti])) {
                    int childTi = topoMap[child];
                    flatChildren[pos++] = childTi;
                    parentCounts[childTi]++;
                }
                // children in topological order, so the CSR rows are deterministic too
                Arrays.sort(flatChildren, offsets[ti], offsets[ti + 1]);
            }
            if (log.isDebugEnabled())
                log.debug("Topological order of {} variables: {}", n, Arrays.toString(ordered));
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
