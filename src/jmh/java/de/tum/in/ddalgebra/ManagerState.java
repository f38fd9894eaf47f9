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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class ManagerState {
    @Param({"1"})
    private float cacheSizeFactor;

    @Param({"true", "false"})
    private boolean useOperationCache;

    private DdManager<BddNode> manager;

    @SuppressWarnings("NumericCastThatLosesPrecision")
    @Setup(Level.Iteration)
    public void setUpManager() {
        manager = DdFactory.buildBddManager(ImmutableDdConfiguration.builder()
                .useOperationCache(useOperationCache)
                .cacheBinaryDivider((int) Math.max(1, DdConfiguration.DEFAULT_CACHE_BINARY_DIVIDER / cacheSizeFactor))
                .cacheQuantificationDivider(
                        (int) Math.max(1, DdConfiguration.DEFAULT_CACHE_QUANTIFICATION_DIVIDER / cacheSizeFactor))
                .cacheReplaceDivider((int) Math.max(1, DdConfiguration.DEFAULT_CACHE_REPLACE_DIVIDER / cacheSizeFactor))
                .cacheRepairDivider((int) Math.max(1, DdConfiguration.DEFAULT_CACHE_REPAIR_DIVIDER / cacheSizeFactor))
                .build());
    }

    public DdManager<BddNode> manager() {
        return manager;
    }
}
