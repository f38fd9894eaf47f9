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

import java.util.Objects;

/**
 * An immutable binary decision diagram node, i.e. the triple {@code (variable, low, high)}.
 */
public final class BddNode implements DdNode {
    private final int variable;
    private final DdIndex low;
    private final DdIndex high;

    public BddNode(int variable, DdIndex low, DdIndex high) {
        assert variable >= 0 : "Negative variable " + variable;
        this.variable = variable;
        this.low = Objects.requireNonNull(low);
        this.high = Objects.requireNonNull(high);
    }

    @Override
    public int variable() {
        return variable;
    }

    @Override
    public DdIndex low() {
        return low;
    }

    @Override
    public DdIndex high() {
        return high;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BddNode)) {
            return false;
        }
        BddNode other = (BddNode) o;
        return variable == other.variable && low.equals(other.low) && high.equals(other.high);
    }

    @Override
    public int hashCode() {
        return HashUtil.hash(variable, low.raw(), high.raw());
    }

    @Override
    public String toString() {
        return String.format("(%d, %s, %s)", variable, low, high);
    }
}
