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

import static de.tum.in.ddalgebra.Util.checkArgument;
import static de.tum.in.ddalgebra.Util.checkState;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Owns the nodes of a decision diagram and provides the memoized operations on them. The manager
 * handles terminal cases, result caching and canonical storage, and delegates the actual recursion
 * step to its {@link DdNodeFactory}, which in turn calls back into the manager for every sub-problem.
 *
 * <p>Nodes are stored such that their low edge never is complemented. Together with the reduction
 * rule of the factory, this makes every function representable by exactly one {@link DdIndex}, so
 * two indices are equal iff they represent the same function.</p>
 *
 * <p>The manager is not thread safe.</p>
 *
 * @param <N> The type of nodes.
 */
public final class DdManager<N extends DdNode> implements DdOperations<N> {
    private static final Logger logger = Logger.getLogger(DdManager.class.getName());

    private final DdNodeFactory<N> factory;
    private final DdConfiguration configuration;
    private final NodePool<N> pool;
    private final OperationCache cache;

    private DdIndex[] variableNodes = new DdIndex[32];
    private int numberOfVariables = 0;

    public DdManager(DdNodeFactory<N> factory, DdConfiguration configuration) {
        this.factory = factory;
        this.configuration = configuration;
        this.pool = new NodePool<>(configuration.initialSize(), configuration.growthFactor(), this::onTableResize);
        this.cache = new OperationCache(configuration, pool.tableSize(), this::statistics);
        factory.bind(this);
        logger.log(Level.FINER, "Created manager {0} with {1}", new Object[] {this, configuration});
    }

    public DdConfiguration configuration() {
        return configuration;
    }

    public DdNodeFactory<N> factory() {
        return factory;
    }

    // Variables

    /**
     * Creates a new variable and returns the index representing it. Variables are numbered
     * sequentially starting from 0.
     */
    public DdIndex createVariable() {
        int variable = numberOfVariables;
        DdIndex node = allocate(factory.id(variable));
        if (variable == variableNodes.length) {
            variableNodes = Arrays.copyOf(variableNodes, variableNodes.length * 2);
        }
        variableNodes[variable] = node;
        numberOfVariables++;
        logger.log(Level.FINEST, "Created variable {0}", variable);
        return node;
    }

    public DdIndex[] createVariables(int count) {
        checkArgument(count > 0, "Count must be positive, got %d", count);
        DdIndex[] array = new DdIndex[count];
        for (int i = 0; i < count; i++) {
            array[i] = createVariable();
        }
        return array;
    }

    /**
     * Returns the index representing the given, previously created variable.
     */
    public DdIndex variable(int variable) {
        checkArgument(0 <= variable && variable < numberOfVariables, "Unknown variable %d", variable);
        return variableNodes[variable];
    }

    public int numberOfVariables() {
        return numberOfVariables;
    }

    // Nodes

    @Override
    public DdIndex allocate(N node) {
        assert isChildOrdered(node, node.low()) && isChildOrdered(node, node.high()) : "Order violated by " + node;
        DdIndex reduced = factory.reduce(node);
        if (reduced != null) {
            return reduced;
        }
        if (node.low().isComplemented()) {
            return DdIndex.of(pool.findOrCreate(factory.flip(node)), true);
        }
        return DdIndex.of(pool.findOrCreate(node), false);
    }

    private boolean isChildOrdered(N node, DdIndex child) {
        return child.isConstant() || node.variable() < pool.node(child.position()).variable();
    }

    @Override
    public N node(int position) {
        return pool.node(position);
    }

    /**
     * Returns the node of a non-constant index as seen through the index, i.e. with children negated
     * if the index is complemented.
     */
    public N resolve(DdIndex index) {
        checkArgument(!index.isConstant(), "Constant %s has no node", index);
        N node = pool.node(index.position());
        return index.isComplemented() ? factory.flip(node) : node;
    }

    /**
     * Returns the top variable of the given index or {@code -1} for a constant.
     */
    public int variableOf(DdIndex index) {
        return index.isConstant() ? -1 : pool.node(index.position()).variable();
    }

    public DdIndex low(DdIndex index) {
        return resolve(index).low();
    }

    public DdIndex high(DdIndex index) {
        return resolve(index).high();
    }

    public boolean isVariable(DdIndex index) {
        return !index.isConstant() && low(index).isFalse() && high(index).isTrue();
    }

    // Operations

    public DdIndex not(DdIndex node) {
        return node.flip();
    }

    @Override
    public DdIndex and(DdIndex left, DdIndex right) {
        if (left.equals(right) || right.isTrue()) {
            return left;
        }
        if (left.isFalse() || right.isFalse() || left.equals(right.flip())) {
            return DdIndex.FALSE;
        }
        if (left.isTrue()) {
            return right;
        }

        DdIndex first = left.raw() <= right.raw() ? left : right;
        DdIndex second = left.raw() <= right.raw() ? right : left;
        if (cache.lookupAnd(first, second)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        DdIndex result = factory.and(first, resolve(first), second, resolve(second));
        cache.putAnd(hash, first, second, result);
        return result;
    }

    @Override
    public DdIndex or(DdIndex left, DdIndex right) {
        return and(left.flip(), right.flip()).flip();
    }

    public DdIndex implies(DdIndex left, DdIndex right) {
        return or(left.flip(), right);
    }

    public DdIndex iff(DdIndex left, DdIndex right) {
        return or(and(left, right), and(left.flip(), right.flip()));
    }

    public DdIndex xor(DdIndex left, DdIndex right) {
        return iff(left, right).flip();
    }

    public DdIndex ite(DdIndex condition, DdIndex thenNode, DdIndex elseNode) {
        return or(and(condition, thenNode), and(condition.flip(), elseNode));
    }

    @Override
    public DdIndex exists(DdIndex node, VariableSet variables) {
        if (node.isConstant() || variables.isEmpty()) {
            return node;
        }
        cache.initExists(variables);
        if (cache.lookupExists(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        DdIndex result = factory.exists(node, resolve(node), variables);
        cache.putExists(hash, node, result);
        return result;
    }

    public DdIndex forall(DdIndex node, VariableSet variables) {
        return exists(node.flip(), variables).flip();
    }

    /**
     * Renames the variables of {@code node} according to {@code variableMap}.
     *
     * @throws IllegalArgumentException if the map targets a variable which was not created.
     */
    @Override
    public DdIndex replace(DdIndex node, VariableMap variableMap) {
        checkArgument(
                variableMap.maxTarget() < numberOfVariables,
                "Map %s targets unknown variable %d",
                variableMap,
                variableMap.maxTarget());
        if (node.isConstant() || variableMap.isIdentity()) {
            return node;
        }
        cache.initReplace(variableMap);
        if (cache.lookupReplace(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        DdIndex result = factory.replace(node, resolve(node), variableMap);
        cache.putReplace(hash, node, result);
        return result;
    }

    @Override
    public DdIndex repairOrder(int level, DdIndex low, DdIndex high) {
        if (cache.lookupRepair(level, low, high)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        DdIndex result = factory.repairOrder(level, low, high);
        cache.putRepair(hash, level, low, high, result);
        return result;
    }

    // Queries

    @Override
    public String display(DdIndex node, boolean negated) {
        if (node.isConstant()) {
            return node.isTrue() == negated ? "false" : "true";
        }
        return factory.display(pool.node(node.position()), negated != node.isComplemented());
    }

    public String toString(DdIndex node) {
        return display(node, false);
    }

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * assignment. Variables beyond the array are treated as {@code false}.
     */
    public boolean evaluate(DdIndex node, boolean[] assignment) {
        DdIndex current = node;
        boolean negated = false;
        while (!current.isConstant()) {
            negated ^= current.isComplemented();
            N stored = pool.node(current.position());
            int variable = stored.variable();
            current = variable < assignment.length && assignment[variable] ? stored.high() : stored.low();
        }
        return current.isTrue() != negated;
    }

    public boolean evaluate(DdIndex node, BitSet assignment) {
        DdIndex current = node;
        boolean negated = false;
        while (!current.isConstant()) {
            negated ^= current.isComplemented();
            N stored = pool.node(current.position());
            current = assignment.get(stored.variable()) ? stored.high() : stored.low();
        }
        return current.isTrue() != negated;
    }

    /**
     * Returns a satisfying assignment of the variables along one path of the given node. Variables
     * not contained in the map may be chosen arbitrarily.
     *
     * @throws NoSuchElementException if the node is {@link DdIndex#FALSE}.
     */
    public Map<Integer, Boolean> satisfyingAssignment(DdIndex node) {
        if (node.isFalse()) {
            throw new NoSuchElementException("False has no satisfying assignment");
        }
        Map<Integer, Boolean> assignment = new HashMap<>();
        DdIndex current = node;
        while (!current.isConstant()) {
            N resolved = resolve(current);
            // Every non-false function has a path to true, so only a false low edge forces high
            boolean high = resolved.low().isFalse();
            factory.sat(resolved, high, assignment);
            current = high ? resolved.high() : resolved.low();
        }
        assert current.isTrue();
        return assignment;
    }

    /**
     * Computes the variables the function of {@code node} depends on.
     */
    public BitSet support(DdIndex node) {
        BitSet support = new BitSet(numberOfVariables);
        forEachReachable(node, stored -> support.set(stored.variable()));
        return support;
    }

    /**
     * Counts the nodes reachable from {@code node}, excluding the constants.
     */
    public int nodeCount(DdIndex node) {
        int[] count = {0};
        forEachReachable(node, stored -> count[0]++);
        return count[0];
    }

    private void forEachReachable(DdIndex node, Consumer<N> action) {
        BitSet visited = new BitSet();
        Deque<DdIndex> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            DdIndex current = stack.pop();
            if (current.isConstant() || visited.get(current.position())) {
                continue;
            }
            visited.set(current.position());
            N stored = pool.node(current.position());
            action.accept(stored);
            stack.push(stored.low());
            stack.push(stored.high());
        }
    }

    /**
     * Counts the satisfying assignments of {@code node} over all created variables.
     */
    public BigInteger countSatisfyingAssignments(DdIndex node) {
        Map<DdIndex, BigInteger> counts = new HashMap<>();
        return countRecursive(node, counts).shiftLeft(levelOf(node));
    }

    private BigInteger countRecursive(DdIndex node, Map<DdIndex, BigInteger> counts) {
        if (node.isConstant()) {
            return node.isTrue() ? BigInteger.ONE : BigInteger.ZERO;
        }
        @Nullable
        BigInteger cached = counts.get(node);
        if (cached != null) {
            return cached;
        }
        N resolved = resolve(node);
        int variable = resolved.variable();
        BigInteger low = countRecursive(resolved.low(), counts).shiftLeft(levelOf(resolved.low()) - variable - 1);
        BigInteger high = countRecursive(resolved.high(), counts).shiftLeft(levelOf(resolved.high()) - variable - 1);
        BigInteger count = low.add(high);
        counts.put(node, count);
        return count;
    }

    private int levelOf(DdIndex node) {
        int variable = variableOf(node);
        assert variable < numberOfVariables : "Variable " + variable + " was not created";
        return variable == -1 ? numberOfVariables : variable;
    }

    // Maintenance

    /**
     * Number of nodes stored by this manager.
     */
    public int storedNodeCount() {
        return pool.size();
    }

    public void invalidateCache() {
        cache.invalidate();
    }

    private void onTableResize(int newSize) {
        logger.log(Level.FINE, "Reallocating caches of {0} for size {1}", new Object[] {this, newSize});
        cache.reallocate(newSize);
    }

    /**
     * Checks the invariants of all stored nodes: uniqueness, variable order, no redundant nodes and
     * no complemented low edges.
     *
     * @throws IllegalStateException if an invariant is violated.
     */
    public boolean check() {
        checkState(pool.check());
        for (int position = NodePool.FIRST_NODE; pool.isValid(position); position++) {
            N node = pool.node(position);
            checkState(!node.low().isComplemented(), "Complemented low edge at %d: %s", position, node);
            checkState(factory.reduce(node) == null, "Redundant node at %d: %s", position, node);
            checkState(
                    isChildOrdered(node, node.low()) && isChildOrdered(node, node.high()),
                    "Order violated at %d: %s",
                    position,
                    node);
        }
        return true;
    }

    public String statistics() {
        return String.format("%s%n%s%nVariables: %d", pool.statistics(), cache.getStatistics(), numberOfVariables);
    }
}
