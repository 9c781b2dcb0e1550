package com.probnet.engine;

import com.probnet.api.CycleDetectedException;
import com.probnet.api.DuplicateVariableException;
import com.probnet.api.UnknownVariableException;
import com.probnet.node.Variable;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    // Structure only matters here, so every node gets a uniform prior
    private Variable node(String name) {
        return Variable.prior(name, 0.5, 0.5);
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
        assertTrue(order.variables().isEmpty());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("A"))
                .build();

        assertEquals(1, order.nodeCount());
        assertEquals("A", order.node(0).name());
        assertEquals(0, order.topoIndex("A"));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraph() {
        // C -> B -> A, inserted in reverse so the names cannot decide the order
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("A")).addVariable(node("B")).addVariable(node("C"))
                .addEdge("C", "B")
                .addEdge("B", "A")
                .build();

        assertEquals(List.of("C", "B", "A"), order.names());
        assertEquals("C -> [B], B -> [A], A", order.toString());

        assertEquals(1, order.childCount(0)); // C has 1 child (B)
        assertEquals(1, order.childCount(1)); // B has 1 child (A)
        assertEquals(0, order.childCount(2));

        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(1));
        assertEquals(1, order.parentCount(2));
    }

    @Test
    public void testDiamondGraph() {
        // A
        // / \
        // C B
        // \ /
        // D
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("D")).addVariable(node("C")).addVariable(node("B")).addVariable(node("A"))
                .addEdge("A", "C")
                .addEdge("A", "B")
                .addEdge("C", "D")
                .addEdge("B", "D")
                .build();

        // B and C are ready together; B wins the tie
        assertEquals(List.of("A", "B", "C", "D"), order.names());

        // children listed in topological order regardless of edge insertion order
        assertEquals(2, order.childCount(0));
        assertEquals(order.topoIndex("B"), order.child(0, 0));
        assertEquals(order.topoIndex("C"), order.child(0, 1));

        assertEquals("A -> [B, C], B -> [D], C -> [D], D", order.toString());

        int idxD = order.topoIndex("D");
        assertEquals(0, order.childCount(idxD));
        assertEquals(2, order.parentCount(idxD));
    }

    @Test
    public void testDisjointGraphs() {
        // A -> B, C -> D
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("C")).addVariable(node("D")).addVariable(node("A")).addVariable(node("B"))
                .addEdge("A", "B")
                .addEdge("C", "D")
                .build();

        // B becomes ready after A and sorts before C
        assertEquals(List.of("A", "B", "C", "D"), order.names());
    }

    @Test
    public void testLexicographicTieBreakWithoutEdges() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("zeta")).addVariable(node("Zeta")).addVariable(node("alpha"))
                .addVariable(node("Beta"))
                .build();
        // String natural order: upper case sorts before lower case
        assertEquals(List.of("Beta", "Zeta", "alpha", "zeta"), order.names());
    }

    @Test
    public void testRepeatedEdgeCountedOnce() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addVariable(node("A")).addVariable(node("B"))
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(1, order.childCount(0));
        assertEquals(1, order.parentCount(1));
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> C -> A, plus an unrelated root
        try {
            TopologicalOrder.builder()
                    .addVariable(node("A")).addVariable(node("B")).addVariable(node("C")).addVariable(node("R"))
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .addEdge("C", "A")
                    .build();
            fail("expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(List.of("A", "B", "C"), e.unresolved());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfLoopDetection() {
        TopologicalOrder.builder()
                .addVariable(node("A"))
                .addEdge("A", "A")
                .build();
    }

    @Test(expected = DuplicateVariableException.class)
    public void testDuplicateNodeException() {
        TopologicalOrder.builder()
                .addVariable(node("A"))
                .addVariable(Variable.prior("A", 0.1, 0.9));
    }

    @Test(expected = UnknownVariableException.class)
    public void testUnknownEdgeSourceException() {
        TopologicalOrder.builder()
                .addVariable(node("B"))
                .addEdge("A", "B");
    }

    @Test(expected = UnknownVariableException.class)
    public void testUnknownEdgeTargetException() {
        TopologicalOrder.builder()
                .addVariable(node("A"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.builder().addVariable(node("A")).build();
        order.topoIndex("UNKNOWN");
    }
}
