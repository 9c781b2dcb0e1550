package com.probnet.util;

import com.probnet.engine.BayesianNetwork;
import com.probnet.engine.EnumerationEngine;
import com.probnet.node.Variable;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CptFormatterTest {

    private static final String SEP = "+----------+----------+----------+\n";

    @Test
    public void testSingleParentTable() {
        Variable b = new Variable("B", 2, new double[][] { { 0.5, 0.2 }, { 0.5, 0.8 } }, List.of("A"),
                new int[] { 2 });
        String expected = SEP
                + "|    A     |   A(0)   |   A(1)   |\n"
                + SEP
                + "|   B(0)   |  0.5000  |  0.2000  |\n"
                + SEP
                + "|   B(1)   |  0.5000  |  0.8000  |\n"
                + SEP;
        assertEquals(expected, CptFormatter.format(b));
    }

    @Test
    public void testFirstParentVariesFastestInHeader() {
        Variable event = new Variable("event", 3, new double[][] {
                { 0.2, 0.2, 0.7, 0.0, 0.2, 0.4 },
                { 0.3, 0.8, 0.2, 0.0, 0.2, 0.4 },
                { 0.5, 0.0, 0.1, 1.0, 0.6, 0.2 } },
                List.of("cond0", "cond1"), new int[] { 3, 2 });
        String[] lines = CptFormatter.format(event).split("\n");
        assertEquals(11, lines.length);
        assertEquals("+----------+" + "----------+".repeat(6), lines[0]);
        assertEquals("|  cond0   | cond0(0) | cond0(1) | cond0(2) | cond0(0) | cond0(1) | cond0(2) |", lines[1]);
        assertEquals("|  cond1   | cond1(0) | cond1(0) | cond1(0) | cond1(1) | cond1(1) | cond1(1) |", lines[3]);
        assertEquals("| event(2) |  0.5000  |  0.0000  |  0.1000  |  1.0000  |  0.6000  |  0.2000  |", lines[9]);
    }

    @Test
    public void testPosteriorFormatting() {
        Variable a = Variable.prior("A", 0.8, 0.2);
        EnumerationEngine engine = new EnumerationEngine(new BayesianNetwork().addVariable(a));
        String expected = "+----------+----------+\n"
                + "|   A(0)   |  0.8000  |\n"
                + "+----------+----------+\n"
                + "|   A(1)   |  0.2000  |\n"
                + "+----------+----------+\n";
        assertEquals(expected, CptFormatter.format(engine.query("A")));
    }

    @Test
    public void testCenterPadsRightOnOddRemainder() {
        assertEquals("    A     ", CptFormatter.center("A"));
        assertEquals("averyveryverylongname", CptFormatter.center("averyveryverylongname"));
    }
}
