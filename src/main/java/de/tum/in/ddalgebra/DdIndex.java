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
 * A reference to a function represented in a decision diagram. An index either is one of the two
 * constants {@link #TRUE} and {@link #FALSE} or points to a position in the node pool of a
 * {@link DdManager}, together with a complement flag. A complemented index represents the
 * negation of the function of the target node, so a function and its negation share a single
 * node.
 *
 * <p>Position {@code 0} is reserved for the constants: {@link #TRUE} is the uncomplemented and
 * {@link #FALSE} the complemented constant. Thus negation of any index is a single flag toggle,
 * see {@link #flip()}.</p>
 */
public final class DdIndex {
    /* Layout: <---POSITION---><COMPLEMENT> */
    private static final int COMPLEMENT_BIT = 1;
    private static final int CONSTANT_POSITION = 0;

    static final int MAXIMAL_POSITION = Integer.MAX_VALUE >>> 1;

    public static final DdIndex TRUE = new DdIndex(CONSTANT_POSITION);
    public static final DdIndex FALSE = new DdIndex(CONSTANT_POSITION | COMPLEMENT_BIT);

    private final int value;

    private DdIndex(int value) {
        this.value = value;
    }

    /**
     * Creates the index pointing to the node stored at {@code position}.
     *
     * @throws IllegalArgumentException if the position is negative or too large.
     */
    public static DdIndex of(int position, boolean complemented) {
        Util.checkArgument(0 <= position && position <= MAXIMAL_POSITION, "Invalid position %d", position);
        return fromRaw((position << 1) | (complemented ? COMPLEMENT_BIT : 0));
    }

    static DdIndex fromRaw(int raw) {
        assert raw >= 0;
        if (raw == TRUE.value) {
            return TRUE;
        }
        if (raw == FALSE.value) {
            return FALSE;
        }
        return new DdIndex(raw);
    }

    /**
     * The packed representation of this index, always non-negative.
     */
    int raw() {
        return value;
    }

    public boolean isConstant() {
        return (value >>> 1) == CONSTANT_POSITION;
    }

    public boolean isTrue() {
        return value == TRUE.value;
    }

    public boolean isFalse() {
        return value == FALSE.value;
    }

    public boolean isComplemented() {
        return (value & COMPLEMENT_BIT) != 0;
    }

    public int position() {
        return value >>> 1;
    }

    /**
     * Returns the index representing the negated function.
     */
    public DdIndex flip() {
        return fromRaw(value ^ COMPLEMENT_BIT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DdIndex)) {
            return false;
        }
        return value == ((DdIndex) o).value;
    }

    @Override
    public int hashCode() {
        return HashUtil.hash(value);
    }

    @Override
    public String toString() {
        if (isConstant()) {
            return isTrue() ? "true" : "false";
        }
        return isComplemented() ? "~" + position() : String.valueOf(position());
    }
}
