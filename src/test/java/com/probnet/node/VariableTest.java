package com.probnet.node;

import com.probnet.api.ArityMismatchException;
import com.probnet.api.InvalidStateException;
import com.probnet.api.MissingParentValueException;
import com.probnet.api.NonNormalizedColumnException;
import com.probnet.api.ShapeMismatchException;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class VariableTest {

    // 3 states, parents cond0 (3 states) and cond1 (2 states); cond0 varies fastest.
    private static final double[][] EVENT_TABLE = {
            { 0.2, 0.2, 0.7, 0.0, 0.2, 0.4 },
            { 0.3, 0.8, 0.2, 0.0, 0.2, 0.4 },
            { 0.5, 0.0, 0.1, 1.0, 0.6, 0.2 }
    };

    private Variable event() {
        return new Variable("event", 3, EVENT_TABLE, List.of("cond0", "cond1"), new int[] { 3, 2 });
    }

    @Test
    public void testEncodingFirstParentVariesFastest() {
        Variable v = event();
        // column = 1 + 1 * 3 = 4
        assertEquals(4, v.columnIndex(Map.of("cond0", 1, "cond1", 1)));
        assertEquals(EVENT_TABLE[0][4], v.probability(0, Map.of("cond0", 1, "cond1", 1)), 0.0);

        for (int c1 = 0; c1 < 2; c1++)
            for (int c0 = 0; c0 < 3; c0++)
                for (int s = 0; s < 3; s++)
                    assertEquals(EVENT_TABLE[s][c0 + 3 * c1],
                            v.probability(s, Map.of("cond0", c0, "cond1", c1)), 0.0);
    }

    @Test
    public void testExtraAssignmentKeysIgnored() {
        Map<String, Integer> assignment = new HashMap<>();
        assignment.put("cond0", 2);
        assignment.put("cond1", 0);
        assignment.put("unrelated", 7);
        assertEquals(0.1, event().probability(2, assignment), 0.0);
    }

    @Test
    public void testPriorFactory() {
        Variable a = Variable.prior("A", 0.8, 0.2);
        assertEquals("A", a.name());
        assertEquals(2, a.cardinality());
        assertEquals(1, a.columnCount());
        assertFalse(a.hasParents());
        assertEquals(0.8, a.probability(0, Map.of()), 0.0);
        assertEquals(0.2, a.probability(1, Map.of()), 0.0);
    }

    @Test
    public void testAccessors() {
        Variable v = event();
        assertEquals(List.of("cond0", "cond1"), v.parents());
        assertArrayEquals(new int[] { 3, 2 }, v.parentCardinalities());
        assertEquals(6, v.columnCount());
        assertArrayEquals(new double[] { 0.0, 0.0, 1.0 }, v.column(3), 0.0);
    }

    @Test
    public void testTableIsCopied() {
        double[][] table = { { 0.5, 0.2 }, { 0.5, 0.8 } };
        Variable b = new Variable("B", 2, table, List.of("A"), new int[] { 2 });
        table[0][0] = 0.9;
        assertEquals(0.5, b.probability(0, Map.of("A", 0)), 0.0);

        b.table()[0][0] = 0.9;
        b.parentCardinalities()[0] = 5;
        assertEquals(0.5, b.probability(0, Map.of("A", 0)), 0.0);
        assertArrayEquals(new int[] { 2 }, b.parentCardinalities());
    }

    @Test
    public void testColumnsSumToOne() {
        Variable v = event();
        for (int c = 0; c < v.columnCount(); c++) {
            double sum = 0;
            for (double p : v.column(c))
                sum += p;
            assertEquals(1.0, sum, Variable.COLUMN_SUM_TOLERANCE);
        }
    }

    @Test
    public void testRoundingWithinToleranceAccepted() {
        Variable v = Variable.prior("third", 1.0 / 3, 1.0 / 3, 1.0 / 3);
        assertEquals(3, v.cardinality());
    }

    @Test(expected = NonNormalizedColumnException.class)
    public void testColumnSummingToPointNineRejected() {
        new Variable("B", 2, new double[][] { { 0.5, 0.2 }, { 0.4, 0.8 } }, List.of("A"), new int[] { 2 });
    }

    @Test
    public void testNonNormalizedColumnReportsColumn() {
        try {
            new Variable("B", 2, new double[][] { { 0.5, 0.2 }, { 0.5, 0.7 } }, List.of("A"), new int[] { 2 });
            fail("expected NonNormalizedColumnException");
        } catch (NonNormalizedColumnException e) {
            assertEquals("B", e.variableName());
            assertEquals(1, e.column());
            assertEquals(0.9, e.sum(), 1e-12);
        }
    }

    @Test(expected = NonNormalizedColumnException.class)
    public void testNegativeEntryRejected() {
        Variable.prior("A", 1.2, -0.2);
    }

    @Test(expected = NonNormalizedColumnException.class)
    public void testNaNEntryRejected() {
        Variable.prior("A", Double.NaN, 1.0);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRowCountMismatch() {
        new Variable("A", 3, new double[][] { { 0.5 }, { 0.5 } });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testColumnCountMismatch() {
        new Variable("B", 2, new double[][] { { 0.5, 0.2, 0.1 }, { 0.5, 0.8, 0.9 } }, List.of("A"),
                new int[] { 2 });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRaggedRows() {
        new Variable("B", 2, new double[][] { { 0.5, 0.2 }, { 0.5 } }, List.of("A"), new int[] { 2 });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testParentlessTableMustHaveOneColumn() {
        new Variable("A", 2, new double[][] { { 0.5, 0.5 }, { 0.5, 0.5 } });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testDuplicateParentRejected() {
        new Variable("B", 2, new double[][] { { 1, 1, 1, 1 }, { 0, 0, 0, 0 } }, List.of("A", "A"),
                new int[] { 2, 2 });
    }

    @Test(expected = ShapeMismatchException.class)
    public void testSelfParentRejected() {
        new Variable("A", 2, new double[][] { { 1, 1 }, { 0, 0 } }, List.of("A"), new int[] { 2 });
    }

    @Test(expected = ArityMismatchException.class)
    public void testArityMismatch() {
        new Variable("B", 2, new double[][] { { 0.5, 0.2 }, { 0.5, 0.8 } }, List.of("A", "C"), new int[] { 2 });
    }

    @Test(expected = ArityMismatchException.class)
    public void testNonPositiveParentCardinality() {
        new Variable("B", 2, new double[][] { {}, {} }, List.of("A"), new int[] { 0 });
    }

    @Test(expected = InvalidStateException.class)
    public void testStateTooLarge() {
        event().probability(3, Map.of("cond0", 0, "cond1", 0));
    }

    @Test(expected = InvalidStateException.class)
    public void testNegativeState() {
        event().probability(-1, Map.of("cond0", 0, "cond1", 0));
    }

    @Test
    public void testParentStateOutOfRange() {
        try {
            event().probability(0, Map.of("cond0", 3, "cond1", 0));
            fail("expected InvalidStateException");
        } catch (InvalidStateException e) {
            assertEquals("cond0", e.variableName());
            assertEquals(3, e.state());
            assertEquals(3, e.cardinality());
        }
    }

    @Test
    public void testMissingParentValue() {
        try {
            event().probability(0, Map.of("cond0", 1));
            fail("expected MissingParentValueException");
        } catch (MissingParentValueException e) {
            assertEquals("event", e.variableName());
            assertEquals("cond1", e.parentName());
        }
    }
}
