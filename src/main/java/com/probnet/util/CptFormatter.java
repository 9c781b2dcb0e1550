package com.probnet.util;

import com.probnet.engine.Posterior;
import com.probnet.node.Variable;

import java.util.List;
import java.util.Locale;

/**
 * Renders conditional probability tables as bordered text grids.
 *
 * <p>
 * One header row per parent shows the parent state of every column (first
 * parent varies fastest), followed by one row per state of the variable:
 *
 * <pre>
 * +----------+----------+----------+
 * |    A     |   A(0)   |   A(1)   |
 * +----------+----------+----------+
 * |   B(0)   |  0.5000  |  0.2000  |
 * +----------+----------+----------+
 * |   B(1)   |  0.5000  |  0.8000  |
 * +----------+----------+----------+
 * </pre>
 *
 * Names longer than the cell width are not truncated and will skew the grid.
 * <b>Usage:</b> intended for logging and debugging, not for hot paths.
 */
public final class CptFormatter {
    private static final int CELL = 10;
    private static final String CELL_BORDER = "-".repeat(CELL) + "+";

    private CptFormatter() {
        // Utility class
    }

    public static String format(Variable v) {
        int width = v.columnCount();
        String separator = "+" + CELL_BORDER + CELL_BORDER.repeat(width) + "\n";
        List<String> parents = v.parents();
        int[] cards = v.parentCardinalities();
        double[][] table = v.table();

        StringBuilder sb = new StringBuilder(separator.length() * (2 * (parents.size() + v.cardinality()) + 1));
        int stride = 1;
        for (int i = 0; i < parents.size(); i++) {
            String parent = parents.get(i);
            sb.append(separator).append('|').append(center(parent)).append('|');
            for (int c = 0; c < width; c++) {
                int state = (c / stride) % cards[i];
                sb.append(center(parent + "(" + state + ")"));
                sb.append(c < width - 1 ? "|" : "|\n");
            }
            stride *= cards[i];
        }

        for (int s = 0; s < v.cardinality(); s++) {
            sb.append(separator).append('|').append(center(v.name() + "(" + s + ")")).append('|');
            for (int c = 0; c < width; c++) {
                sb.append(center(String.format(Locale.ROOT, "%.4f", table[s][c])));
                sb.append(c < width - 1 ? "|" : "|\n");
            }
        }
        return sb.append(separator).toString();
    }

    public static String format(Posterior posterior) {
        return format(posterior.toVariable());
    }

    // Extra padding goes to the right when it cannot be split evenly.
    static String center(String s) {
        if (s.length() >= CELL)
            return s;
        int left = (CELL - s.length()) / 2;
        int right = CELL - s.length() - left;
        return " ".repeat(left) + s + " ".repeat(right);
    }
}
