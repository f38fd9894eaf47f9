/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.ddalgebra;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DdManagerTest {
    private DdManager<BddNode> manager;

    @BeforeEach
    public void setUp() {
        manager = DdFactory.buildBddManager();
    }

    @Test
    public void testVariables() {
        DdIndex[] variables = manager.createVariables(3);
        assertThat(manager.numberOfVariables(), is(3));
        for (int i = 0; i < 3; i++) {
            assertThat(manager.variable(i), is(variables[i]));
            assertThat(manager.isVariable(variables[i]), is(true));
            assertThat(manager.variableOf(variables[i]), is(i));
            assertThat(manager.isVariable(manager.not(variables[i])), is(false));
        }
        assertThat(manager.storedNodeCount(), is(3));
        assertThrows(IllegalArgumentException.class, () -> manager.variable(3));
        assertThrows(IllegalArgumentException.class, () -> manager.createVariables(0));
    }

    @Test
    public void testConstants() {
        DdIndex v0 = manager.createVariable();
        assertThat(manager.and(v0, DdIndex.TRUE), is(v0));
        assertThat(manager.and(DdIndex.FALSE, v0), is(DdIndex.FALSE));
        assertThat(manager.or(v0, DdIndex.TRUE), is(DdIndex.TRUE));
        assertThat(manager.or(DdIndex.FALSE, v0), is(v0));
        assertThat(manager.variableOf(DdIndex.TRUE), is(-1));
        assertThrows(IllegalArgumentException.class, () -> manager.resolve(DdIndex.FALSE));
    }

    @Test
    public void testStoredLowEdgeNotComplemented() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        DdIndex and = manager.and(v0, v1);

        BddNode stored = manager.node(and.position());
        assertThat(stored.low().isComplemented(), is(false));
        // (x0, false, x1) is stored as its complement
        assertThat(and.isComplemented(), is(true));
        assertThat(manager.allocate(new BddNode(0, DdIndex.FALSE, v1)), is(and));
        assertThat(manager.allocate(new BddNode(0, DdIndex.TRUE, manager.not(v1))), is(manager.not(and)));
        assertThat(manager.allocate(new BddNode(0, v1, v1)), is(v1));
    }

    @Test
    public void testAndOfVariables() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        DdIndex and = manager.and(v0, v1);
        assertThat(manager.variableOf(and), is(0));
        assertThat(manager.low(and), is(DdIndex.FALSE));
        assertThat(manager.high(and), is(v1));

        assertThat(manager.exists(and, VariableSet.of(0)), is(v1));
        assertThat(manager.exists(and, VariableSet.of(1)), is(v0));
        assertThat(manager.exists(and, VariableSet.of(0, 1)), is(DdIndex.TRUE));
        assertThat(manager.forall(and, VariableSet.of(0)), is(DdIndex.FALSE));
    }

    @Test
    public void testSwapConjunction() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        DdIndex and = manager.and(v0, v1);

        DdIndex swapped = manager.replace(and, VariableMap.swap(0, 1));
        assertThat(swapped, is(and));
        assertThat(manager.variableOf(swapped), is(0));
        assertThat(manager.check(), is(true));
    }

    @Test
    public void testSwapImplication() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();

        DdIndex swapped = manager.replace(manager.implies(v0, v1), VariableMap.swap(0, 1));
        assertThat(swapped, is(manager.implies(v1, v0)));
        assertThat(manager.replace(swapped, VariableMap.identity()), is(swapped));
    }

    @Test
    public void testReplaceOntoUnknownVariable() {
        DdIndex[] v = manager.createVariables(2);
        DdIndex and = manager.and(v[0], v[1]);
        assertThrows(IllegalArgumentException.class, () -> manager.replace(and, VariableMap.of(Map.of(0, 2))));
        assertThrows(IllegalArgumentException.class, () -> manager.replace(DdIndex.TRUE, VariableMap.swap(1, 5)));

        manager.createVariable();
        DdIndex replaced = manager.replace(and, VariableMap.of(Map.of(0, 2)));
        assertThat(replaced, is(manager.and(v[1], manager.variable(2))));
        assertThat(manager.countSatisfyingAssignments(replaced), is(BigInteger.valueOf(2)));
    }

    @Test
    public void testDisplay() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        assertThat(manager.toString(DdIndex.TRUE), is("true"));
        assertThat(manager.toString(DdIndex.FALSE), is("false"));
        assertThat(manager.display(DdIndex.TRUE, true), is("false"));
        assertThat(manager.toString(v0), is("(0 ? true : false)"));
        assertThat(manager.toString(manager.not(v0)), is("(0 ? false : true)"));
        assertThat(manager.toString(manager.and(v0, v1)), is("(0 ? (1 ? true : false) : false)"));
        assertThat(manager.toString(manager.or(v0, v1)), is("(0 ? true : (1 ? true : false))"));
    }

    @Test
    public void testEvaluate() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        DdIndex xor = manager.xor(v0, v1);
        assertThat(manager.evaluate(xor, new boolean[] {true, false}), is(true));
        assertThat(manager.evaluate(xor, new boolean[] {true, true}), is(false));
        // Missing entries are false
        assertThat(manager.evaluate(xor, new boolean[] {true}), is(true));

        BitSet assignment = new BitSet();
        assignment.set(1);
        assertThat(manager.evaluate(xor, assignment), is(true));
        assertThat(manager.evaluate(manager.not(xor), assignment), is(false));
    }

    @Test
    public void testSatisfyingAssignment() {
        DdIndex v0 = manager.createVariable();
        DdIndex v1 = manager.createVariable();
        assertThat(manager.satisfyingAssignment(manager.and(v0, manager.not(v1))), is(Map.of(0, true, 1, false)));
        assertThat(manager.satisfyingAssignment(DdIndex.TRUE), is(Map.of()));
        assertThrows(NoSuchElementException.class, () -> manager.satisfyingAssignment(DdIndex.FALSE));
    }

    @Test
    public void testCounting() {
        DdIndex[] v = manager.createVariables(4);
        assertThat(manager.countSatisfyingAssignments(DdIndex.TRUE), is(BigInteger.valueOf(16)));
        assertThat(manager.countSatisfyingAssignments(DdIndex.FALSE), is(BigInteger.ZERO));
        assertThat(manager.countSatisfyingAssignments(v[2]), is(BigInteger.valueOf(8)));
        assertThat(manager.countSatisfyingAssignments(manager.or(v[1], v[3])), is(BigInteger.valueOf(12)));

        DdIndex and = manager.and(v[0], manager.and(v[1], v[3]));
        assertThat(manager.countSatisfyingAssignments(and), is(BigInteger.valueOf(2)));
        assertThat(manager.nodeCount(and), is(3));
        BitSet support = manager.support(and);
        assertThat(support.cardinality(), is(3));
        assertThat(support.get(2), is(false));
    }

    @Test
    public void testCacheInvalidationKeepsResults() {
        DdIndex[] v = manager.createVariables(3);
        DdIndex formula = manager.or(manager.and(v[0], v[1]), v[2]);
        DdIndex exists = manager.exists(formula, VariableSet.of(1));
        manager.invalidateCache();
        assertThat(manager.or(manager.and(v[0], v[1]), v[2]), is(formula));
        assertThat(manager.exists(formula, VariableSet.of(1)), is(exists));
        assertThat(manager.exists(formula, VariableSet.of(2)), is(DdIndex.TRUE));
        assertThat(manager.exists(formula, VariableSet.of(1)), is(manager.or(v[0], v[2])));
    }

    @Test
    public void testGrowth() {
        DdManager<BddNode> small = DdFactory.buildBddManager(
                ImmutableDdConfiguration.builder().initialSize(1).build());
        DdIndex queens = ProblemBuilder.makeQueens(small, 6);
        assertThat(small.countSatisfyingAssignments(queens), is(BigInteger.valueOf(4)));
        assertThat(small.check(), is(true));
        assertThat(small.statistics(), containsString("Node pool"));
    }
}
