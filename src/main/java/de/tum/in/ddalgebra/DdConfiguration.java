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

import org.immutables.value.Value;

/**
 * Settings of a {@link DdManager}. Instances are created through the generated
 * {@code ImmutableDdConfiguration.builder()}.
 */
@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class DdConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;
    public static final int DEFAULT_CACHE_BINARY_DIVIDER = 32;
    public static final int DEFAULT_CACHE_QUANTIFICATION_DIVIDER = 64;
    public static final int DEFAULT_CACHE_REPLACE_DIVIDER = 32;
    public static final int DEFAULT_CACHE_REPAIR_DIVIDER = 32;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    @Value.Default
    public int cacheBinaryDivider() {
        return DEFAULT_CACHE_BINARY_DIVIDER;
    }

    @Value.Default
    public int cacheQuantificationDivider() {
        return DEFAULT_CACHE_QUANTIFICATION_DIVIDER;
    }

    @Value.Default
    public int cacheReplaceDivider() {
        return DEFAULT_CACHE_REPLACE_DIVIDER;
    }

    @Value.Default
    public int cacheRepairDivider() {
        return DEFAULT_CACHE_REPAIR_DIVIDER;
    }

    /**
     * Whether results of and, exists, replace and order repair are memoized. Disabling the cache does
     * not change any result, only the running time.
     */
    @Value.Default
    public boolean useOperationCache() {
        return true;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must be larger than 1, got %s", growthFactor());
        Util.checkArgument(
                cacheBinaryDivider() > 0
                        && cacheQuantificationDivider() > 0
                        && cacheReplaceDivider() > 0
                        && cacheRepairDivider() > 0,
                "Cache dividers must be positive");
    }
}
