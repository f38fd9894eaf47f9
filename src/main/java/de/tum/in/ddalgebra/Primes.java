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

final class Primes {
    private Primes() {}

    static int nextPrime(int value) {
        int candidate = Math.max(3, value | 1);
        while (!isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

    static boolean isPrime(int value) {
        if (value < 2) {
            return false;
        }
        if (value < 4) {
            return true;
        }
        if (value % 2 == 0 || value % 3 == 0) {
            return false;
        }
        // All remaining divisors are of the form 6k +- 1
        for (long divisor = 5L; divisor * divisor <= value; divisor += 6L) {
            if (value % divisor == 0L || value % (divisor + 2L) == 0L) {
                return false;
            }
        }
        return true;
    }
}
