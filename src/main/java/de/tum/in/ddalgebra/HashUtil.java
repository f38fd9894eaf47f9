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

final class HashUtil {
    // Cheap mixing only, as these are called on every allocation and every cache access.

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int key) {
        return key * PRIME;
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return PRIME * ((PRIME * firstKey) + secondKey) + thirdKey;
    }

    static int hash(byte operation, int firstKey, int secondKey) {
        return PRIME * ((PRIME * operation) + firstKey) + secondKey;
    }

    static int mod(int hash, int modulus) {
        int value = hash % modulus;
        return value < 0 ? value + modulus : value;
    }
}
