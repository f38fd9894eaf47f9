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
 * A node of a decision diagram with a decision variable and two outgoing edges. Nodes are
 * immutable and compared structurally; the {@link DdManager} guarantees that no two equal nodes
 * are stored.
 */
public interface DdNode {
    /**
     * The decision variable of this node.
     */
    int variable();

    /**
     * The edge taken if the variable is {@code false}.
     */
    DdIndex low();

    /**
     * The edge taken if the variable is {@code true}.
     */
    DdIndex high();
}
