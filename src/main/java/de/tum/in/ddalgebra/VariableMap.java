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
import java.util.Map;
import java.util.StringJoiner;

/**
 * An immutable partial map from variables to variables, used to rename the variables of a
 * function. Unmapped variables are mapped to themselves.
 */
public final class VariableMap {
    static final int UNMAPPED = -1;
    private static final VariableMap IDENTITY = new VariableMap(new int[0]);

    /* Index is the source variable, entries mapping a variable onto itself are stored as UNMAPPED
     * and trailing UNMAPPED entries are trimmed, so equal maps have equal arrays. */
    private final int[] mapping;
    private final int maxTarget;
    private final int hashCode;

    private VariableMap(int[] mapping) {
        this.mapping = mapping;
        this.maxTarget = Arrays.stream(mapping).max().orElse(UNMAPPED);
        this.hashCode = Arrays.hashCode(mapping);
    }

    public static VariableMap identity() {
        return IDENTITY;
    }

    /**
     * Creates the map given by {@code replacement}, where {@code replacement[i]} is the new variable
     * for variable {@code i} and {@code -1} means "not replaced".
     */
    public static VariableMap of(int[] replacement) {
        int[] mapping = new int[replacement.length];
        int length = 0;
        for (int variable = 0; variable < replacement.length; variable++) {
            int target = replacement[variable];
            Util.checkArgument(target >= UNMAPPED, "Invalid replacement %d for variable %d", target, variable);
            if (target == UNMAPPED || target == variable) {
                mapping[variable] = UNMAPPED;
            } else {
                mapping[variable] = target;
                length = variable + 1;
            }
        }
        return length == 0 ? IDENTITY : new VariableMap(Arrays.copyOf(mapping, length));
    }

    public static VariableMap of(Map<Integer, Integer> replacement) {
        int length = 0;
        for (Map.Entry<Integer, Integer> entry : replacement.entrySet()) {
            int variable = entry.getKey();
            int target = entry.getValue();
            Util.checkArgument(variable >= 0 && target >= 0, "Invalid replacement %d -> %d", variable, target);
            length = Math.max(length, variable + 1);
        }
        int[] mapping = new int[length];
        Arrays.fill(mapping, UNMAPPED);
        replacement.forEach((variable, target) -> mapping[variable] = target);
        return of(mapping);
    }

    /**
     * Creates the map exchanging the two given variables.
     */
    public static VariableMap swap(int first, int second) {
        Util.checkArgument(first >= 0 && second >= 0, "Invalid swap %d <-> %d", first, second);
        int[] mapping = new int[Math.max(first, second) + 1];
        Arrays.fill(mapping, UNMAPPED);
        mapping[first] = second;
        mapping[second] = first;
        return of(mapping);
    }

    /**
     * Returns the replacement of {@code variable} or {@code -1} if it is not replaced.
     */
    public int get(int variable) {
        return variable < mapping.length ? mapping[variable] : UNMAPPED;
    }

    /**
     * Returns the variable which {@code variable} is mapped to.
     */
    public int apply(int variable) {
        int target = get(variable);
        return target == UNMAPPED ? variable : target;
    }

    /**
     * Returns the largest variable which is replaced by a different one or {@code -1} if this is the
     * identity. Nodes with a larger variable are left unchanged by the replacement.
     */
    public int maxIndex() {
        return mapping.length - 1;
    }

    /**
     * Returns the largest variable some variable is replaced by or {@code -1} if this is the identity.
     */
    public int maxTarget() {
        return maxTarget;
    }

    public boolean isIdentity() {
        return mapping.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableMap)) {
            return false;
        }
        VariableMap other = (VariableMap) o;
        return hashCode == other.hashCode && Arrays.equals(mapping, other.mapping);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (int variable = 0; variable < mapping.length; variable++) {
            if (mapping[variable] != UNMAPPED) {
                joiner.add(variable + "->" + mapping[variable]);
            }
        }
        return joiner.toString();
    }
}
