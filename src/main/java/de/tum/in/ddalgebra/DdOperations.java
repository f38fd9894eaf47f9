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

/**
 * The entry points of a {@link DdManager} which a {@link DdNodeFactory} calls back into. All
 * operations except {@link #allocate(DdNode)} and {@link #node(int)} are memoized by the manager,
 * hence a factory must recurse only through these methods and never on the raw node structure.
 *
 * @param <N> The type of nodes.
 */
public interface DdOperations<N extends DdNode> {
    /**
     * Returns the canonical index of the given node, creating it if necessary. Redundant nodes are
     * reduced according to {@link DdNodeFactory#reduce(DdNode)} instead of being stored.
     */
    DdIndex allocate(N node);

    DdIndex and(DdIndex left, DdIndex right);

    DdIndex or(DdIndex left, DdIndex right);

    DdIndex exists(DdIndex node, VariableSet variables);

    DdIndex replace(DdIndex node, VariableMap variableMap);

    /**
     * Returns the function {@code level ? high : low} for arbitrary ordered operands.
     */
    DdIndex repairOrder(int level, DdIndex low, DdIndex high);

    /**
     * Returns the node stored at the given pool position. Positions are stable for the lifetime of
     * the manager.
     */
    N node(int position);

    /**
     * Renders the function of {@code node}, negated if {@code negated} is set.
     */
    String display(DdIndex node, boolean negated);
}
