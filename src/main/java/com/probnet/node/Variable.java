package com.probnet.node;

import com.probnet.api.ArityMismatchException;
import com.probnet.api.InvalidStateException;
import com.probnet.api.MissingParentValueException;
import com.probnet.api.NonNormalizedColumnException;
import com.probnet.api.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A discrete random variable and its conditional probability table (CPT).
 *
 * <p>
 * The table has one row per state of this variable and one column per
 * combination of parent states. Column {@code c} holds the distribution of
 * this variable given the parent combination that encodes to {@code c}.
 *
 * <h3>Column encoding</h3>
 * Parent combinations map to columns with a mixed-radix encoding in which the
 * first listed parent varies fastest:
 *
 * <pre>
 * column = sum_i state(parents[i]) * prod_{j &lt; i} parentCardinalities[j]
 * </pre>
 *
 * A variable with three states and parents {@code cond0} (3 states) and
 * {@code cond1} (2 states) therefore lays out its six columns as
 * {@code (0,0) (1,0) (2,0) (0,1) (1,1) (2,1)}.
 *
 * <p>
 * Instances are validated on construction and immutable afterwards. The
 * table is copied on the way in and on the way out.
 */
public final class Variable {
    /** Absolute tolerance applied when checking that every column sums to 1. */
    public static final double COLUMN_SUM_TOLERANCE = 1e-9;

    private final String name;
    private final int cardinality;
    private final double[][] table;
    private final List<String> parents;
    private final int[] parentCardinalities;
    // stride[i] = product of the cardinalities of the parents listed before i
    private final int[] strides;
    private final int columnCount;

    /** Creates a parentless variable whose table is a single-column prior. */
    public Variable(String name, int cardinality, double[][] table) {
        this(name, cardinality, table, Collections.emptyList(), new int[0]);
    }

    /**
     * Creates a variable conditioned on the given parents.
     *
     * @throws ArityMismatchException       if {@code parents} and
     *                                      {@code parentCardinalities} differ in
     *                                      length, or a parent cardinality is
     *                                      not positive.
     * @throws ShapeMismatchException       if the table does not have
     *                                      {@code cardinality} rows of
     *                                      {@code prod(parentCardinalities)}
     *                                      columns each.
     * @throws NonNormalizedColumnException if a column is not a probability
     *                                      distribution.
     */
    public Variable(String name, int cardinality, double[][] table, List<String> parents,
            int[] parentCardinalities) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Variable name must not be empty");
        if (parents == null || parentCardinalities == null)
            throw new ArityMismatchException(name, "parents and parentCardinalities must not be null");
        if (parents.size() != parentCardinalities.length)
            throw new ArityMismatchException(name, "has " + parents.size() + " parents but "
                    + parentCardinalities.length + " parent cardinalities");
        if (cardinality <= 0)
            throw new ShapeMismatchException(name, "cardinality must be positive, got " + cardinality);

        Set<String> seen = new HashSet<>();
        for (String parent : parents) {
            if (parent == null || parent.equals(name))
                throw new ShapeMismatchException(name, "invalid parent name: " + parent);
            if (!seen.add(parent))
                throw new ShapeMismatchException(name, "parent listed twice: " + parent);
        }

        int[] strideArr = new int[parentCardinalities.length];
        long columns = 1;
        for (int i = 0; i < parentCardinalities.length; i++) {
            if (parentCardinalities[i] <= 0)
                throw new ArityMismatchException(name, "parent '" + parents.get(i)
                        + "' has non-positive cardinality " + parentCardinalities[i]);
            strideArr[i] = (int) columns;
            columns *= parentCardinalities[i];
            if (columns > Integer.MAX_VALUE)
                throw new ShapeMismatchException(name, "too many parent combinations");
        }

        if (table == null || table.length != cardinality)
            throw new ShapeMismatchException(name, "table has " + (table == null ? 0 : table.length)
                    + " rows, expected " + cardinality);
        double[][] copy = new double[cardinality][];
        for (int r = 0; r < cardinality; r++) {
            if (table[r] == null || table[r].length != columns)
                throw new ShapeMismatchException(name, "row " + r + " has "
                        + (table[r] == null ? 0 : table[r].length) + " columns, expected " + columns);
            copy[r] = table[r].clone();
        }

        for (int c = 0; c < columns; c++) {
            double sum = 0.0;
            for (int r = 0; r < cardinality; r++) {
                double p = copy[r][c];
                if (!Double.isFinite(p) || p < 0.0)
                    throw new NonNormalizedColumnException(name, c, "has invalid entry " + p + " at row " + r);
                sum += p;
            }
            if (Math.abs(sum - 1.0) > COLUMN_SUM_TOLERANCE)
                throw new NonNormalizedColumnException(name, c, sum);
        }

        this.name = name;
        this.cardinality = cardinality;
        this.table = copy;
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
        this.parentCardinalities = parentCardinalities.clone();
        this.strides = strideArr;
        this.columnCount = (int) columns;
    }

    /**
     * Creates a parentless variable from its prior distribution, one
     * probability per state.
     */
    public static Variable prior(String name, double... distribution) {
        double[][] table = new double[distribution.length][1];
        for (int i = 0; i < distribution.length; i++)
            table[i][0] = distribution[i];
        return new Variable(name, distribution.length, table);
    }

    public String name() {
        return name;
    }

    public int cardinality() {
        return cardinality;
    }

    /** Parent names in encoding order. */
    public List<String> parents() {
        return parents;
    }

    public int[] parentCardinalities() {
        return parentCardinalities.clone();
    }

    public int columnCount() {
        return columnCount;
    }

    public boolean hasParents() {
        return !parents.isEmpty();
    }

    /** Returns a deep copy of the table, indexed {@code [state][column]}. */
    public double[][] table() {
        double[][] copy = new double[cardinality][];
        for (int r = 0; r < cardinality; r++)
            copy[r] = table[r].clone();
        return copy;
    }

    /** Returns the conditional distribution stored in one column. */
    public double[] column(int column) {
        if (column < 0 || column >= columnCount)
            throw new IndexOutOfBoundsException("Column " + column + " of " + columnCount);
        double[] out = new double[cardinality];
        for (int r = 0; r < cardinality; r++)
            out[r] = table[r][column];
        return out;
    }

    /**
     * Encodes a parent assignment to its table column. Keys that are not
     * parents of this variable are ignored.
     *
     * @throws MissingParentValueException if a declared parent has no value.
     * @throws InvalidStateException       if a parent value is outside that
     *                                     parent's cardinality.
     */
    public int columnIndex(Map<String, Integer> parentAssignment) {
        int column = 0;
        for (int i = 0; i < strides.length; i++) {
            String parent = parents.get(i);
            Integer state = parentAssignment.get(parent);
            if (state == null)
                throw new MissingParentValueException(name, parent);
            if (state < 0 || state >= parentCardinalities[i])
                throw new InvalidStateException(parent, state, parentCardinalities[i]);
            column += state * strides[i];
        }
        return column;
    }

    /**
     * Probability of this variable taking {@code state} given the parent
     * states. This is a table lookup; nothing is computed.
     *
     * @throws InvalidStateException       if {@code state} is out of range.
     * @throws MissingParentValueException if a declared parent has no value.
     */
    public double probability(int state, Map<String, Integer> parentAssignment) {
        if (state < 0 || state >= cardinality)
            throw new InvalidStateException(name, state, cardinality);
        return table[state][columnIndex(parentAssignment)];
    }

    @Override
    public String toString() {
        return "Variable{" + name + ", states=" + cardinality + ", parents=" + parents
                + Arrays.toString(parentCardinalities) + "}";
    }
}
