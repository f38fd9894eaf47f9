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

import java.util.Map;
import javax.annotation.Nullable;

/**
 * The node-kind specific operations of a decision diagram. Given already resolved operands, an
 * implementation decides how to recurse into the sub-functions for the current top variable and
 * how to assemble the result. Checking for previously computed results, terminal cases and storing
 * nodes is the responsibility of the {@link DdManager}, which the factory is {@link
 * #bind(DdOperations) bound} to.
 *
 * <p>Operand nodes passed to the operations are <i>effective</i> nodes: if the operand index is
 * complemented, the node is the {@link #flip(DdNode) flipped} pool node.</p>
 *
 * @param <N> The type of nodes.
 */
public interface DdNodeFactory<N extends DdNode> {
    /**
     * Binds this factory to the manager owning the nodes. Called exactly once, by the manager.
     *
     * @throws IllegalStateException if the factory already is bound.
     */
    void bind(DdOperations<N> operations);

    /**
     * Computes the conjunction of two non-constant operands.
     */
    DdIndex and(DdIndex xid, N x, DdIndex yid, N y);

    /**
     * Existentially quantifies all {@code variables} from the non-constant operand.
     */
    DdIndex exists(DdIndex xid, N x, VariableSet variables);

    /**
     * Renames the variables of the non-constant operand according to {@code variableMap}, keeping the
     * variable order intact.
     */
    DdIndex replace(DdIndex xid, N x, VariableMap variableMap);

    /**
     * Builds the function {@code level ? high : low}, where {@code low} and {@code high} may contain
     * variables smaller than or equal to {@code level}.
     */
    DdIndex repairOrder(int level, DdIndex low, DdIndex high);

    /**
     * Returns a copy of {@code node} with both children negated.
     */
    N flip(N node);

    /**
     * Returns the node representing the given variable.
     */
    N id(int variable);

    /**
     * Applies the reduction rules to a candidate node.
     *
     * @return The index the node collapses to or {@code null} if the node is not redundant.
     */
    @Nullable
    DdIndex reduce(N node);

    /**
     * Renders the given node, with {@code negated} indicating the parity of complement edges on the
     * path to it.
     */
    String display(N node, boolean negated);

    /**
     * Records the decision taken at {@code node} in {@code assignment}.
     */
    void sat(N node, boolean high, Map<Integer, Boolean> assignment);
}
