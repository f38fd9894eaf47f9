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

import java.util.Arrays;
import java.util.BitSet;

/**
 * An immutable set of variables, e.g. the variables to quantify over.
 */
public final class VariableSet {
    private static final VariableSet EMPTY = new VariableSet(new BitSet());

    private final BitSet variables;
    private final int hashCode;

    private VariableSet(BitSet variables) {
        this.variables = variables;
        this.hashCode = variables.hashCode();
    }

    public static VariableSet empty() {
        return EMPTY;
    }

    /**
     * Creates the set containing the given {@code variables}.
     *
     * @throws IllegalArgumentException if any of the variables is negative.
     */
    public static VariableSet of(int... variables) {
        if (variables.length == 0) {
            return EMPTY;
        }
        BitSet set = new BitSet();
        for (int variable : variables) {
            Util.checkArgument(variable >= 0, "Negative variable %d", variable);
            set.set(variable);
        }
        return new VariableSet(set);
    }

    public static VariableSet of(BitSet variables) {
        return variables.isEmpty() ? EMPTY : new VariableSet(BitSets.copyOf(variables));
    }

    public boolean contains(int variable) {
        return variable >= 0 && variables.get(variable);
    }

    /**
     * Returns the largest variable in this set or {@code -1} if it is empty. Nodes with a larger
     * variable do not depend on any variable of this set.
     */
    public int maxIndex() {
        return variables.length() - 1;
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public int size() {
        return variables.cardinality();
    }

    public BitSet toBitSet() {
        return BitSets.copyOf(variables);
    }

    public int[] toArray() {
        return BitSets.toArray(variables);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableSet)) {
            return false;
        }
        VariableSet other = (VariableSet) o;
        return hashCode == other.hashCode && variables.equals(other.variables);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
