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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

public class OperationCacheTest {
    private static final DdIndex A = DdIndex.of(3, false);
    private static final DdIndex B = DdIndex.of(5, true);
    private static final DdIndex RESULT = DdIndex.of(8, true);

    private static OperationCache cache(boolean enabled) {
        DdConfiguration configuration = ImmutableDdConfiguration.builder()
                .useOperationCache(enabled)
                .build();
        return new OperationCache(configuration, 1024, () -> "");
    }

    @Test
    public void testBinary() {
        OperationCache cache = cache(true);
        assertThat(cache.lookupAnd(A, B), is(false));
        cache.putAnd(cache.lookupHash(), A, B, RESULT);
        assertThat(cache.lookupAnd(A, B), is(true));
        assertThat(cache.lookupResult(), is(RESULT));
        assertThat(cache.lookupAnd(A, A), is(false));

        cache.invalidate();
        assertThat(cache.lookupAnd(A, B), is(false));
    }

    @Test
    public void testQuantificationDependsOnSet() {
        OperationCache cache = cache(true);
        cache.initExists(VariableSet.of(1, 2));
        assertThat(cache.lookupExists(A), is(false));
        cache.putExists(cache.lookupHash(), A, RESULT);

        cache.initExists(VariableSet.of(1, 2));
        assertThat(cache.lookupExists(A), is(true));
        assertThat(cache.lookupResult(), is(RESULT));

        cache.initExists(VariableSet.of(1));
        assertThat(cache.lookupExists(A), is(false));
    }

    @Test
    public void testReplaceDependsOnMap() {
        OperationCache cache = cache(true);
        cache.initReplace(VariableMap.swap(0, 1));
        assertThat(cache.lookupReplace(B), is(false));
        cache.putReplace(cache.lookupHash(), B, A);
        assertThat(cache.lookupReplace(B), is(true));
        assertThat(cache.lookupResult(), is(A));

        cache.reallocate(4096);
        assertThat(cache.lookupReplace(B), is(false));
        cache.putReplace(cache.lookupHash(), B, A);

        cache.initReplace(VariableMap.swap(1, 2));
        assertThat(cache.lookupReplace(B), is(false));
    }

    @Test
    public void testRepairIndependentOfMap() {
        OperationCache cache = cache(true);
        cache.initReplace(VariableMap.swap(0, 1));
        assertThat(cache.lookupRepair(2, A, B), is(false));
        cache.putRepair(cache.lookupHash(), 2, A, B, RESULT);

        cache.initReplace(VariableMap.swap(1, 2));
        assertThat(cache.lookupRepair(2, A, B), is(true));
        assertThat(cache.lookupResult(), is(RESULT));
        assertThat(cache.lookupRepair(3, A, B), is(false));
        assertThat(cache.lookupRepair(2, B, A), is(false));

        cache.invalidate();
        assertThat(cache.lookupRepair(2, A, B), is(false));
    }

    @Test
    public void testDisabled() {
        OperationCache cache = cache(false);
        assertThat(cache.lookupAnd(A, B), is(false));
        cache.putAnd(cache.lookupHash(), A, B, RESULT);
        assertThat(cache.lookupAnd(A, B), is(false));
        cache.initExists(VariableSet.of(0));
        assertThat(cache.lookupExists(A), is(false));
        assertThat(cache.lookupRepair(0, A, B), is(false));
        cache.invalidate();
        assertThat(cache.getStatistics(), is(not(emptyString())));
    }
}
