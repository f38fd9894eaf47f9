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
import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Memoization tables of a {@link DdManager}. Each table is direct-mapped: a new entry overwrites
 * whatever was stored at its position, so a lookup may miss a previously computed result but never
 * returns a wrong one.
 *
 * <p>Quantification and replacement results depend on the variable set or map. Only results for
 * the most recently used set or map are kept; switching clears the respective table. Order repair
 * results only depend on their operands.</p>
 */
@SuppressWarnings("PMD.TooManyFields")
final class OperationCache {
    private static final byte NOT_AN_OPERATION = 0;
    private static final byte BINARY_OPERATION_AND = 1;

    private static final int EMPTY = -1;
    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    private static final Logger logger = Logger.getLogger(OperationCache.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<OperationCache> cacheShutdownHook = new ConcurrentLinkedDeque<>();

    private final DdConfiguration configuration;
    private final Supplier<String> ownerStatistics;
    private final boolean enabled;
    private final CacheStatistics binaryStatistics = new CacheStatistics();
    private final CacheStatistics quantificationStatistics = new CacheStatistics();
    private final CacheStatistics replaceStatistics = new CacheStatistics();
    private final CacheStatistics repairStatistics = new CacheStatistics();

    private int binaryKeyCount = 0;
    private byte[] binaryOp = EMPTY_BYTE_ARRAY;
    private int[] binaryCache = EMPTY_INT_ARRAY;

    @Nullable
    private VariableSet quantificationSet = null;
    private int quantificationKeyCount = 0;
    private int[] quantificationCache = EMPTY_INT_ARRAY;

    @Nullable
    private VariableMap replaceMap = null;
    private int replaceKeyCount = 0;
    private int[] replaceCache = EMPTY_INT_ARRAY;

    private int repairKeyCount = 0;
    private int[] repairCache = EMPTY_INT_ARRAY;

    private int lookupHash = -1;
    private DdIndex lookupResult = DdIndex.FALSE;

    OperationCache(DdConfiguration configuration, int tableSize, Supplier<String> ownerStatistics) {
        this.configuration = configuration;
        this.ownerStatistics = ownerStatistics;
        this.enabled = configuration.useOperationCache();

        reallocate(tableSize);

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(OperationCache cache) {
        ShutdownHookLazyHolder.init();
        cacheShutdownHook.add(cache);
    }

    private static int keyCount(int tableSize, int divider) {
        return Primes.nextPrime(Math.max(tableSize / divider, 1));
    }

    int lookupHash() {
        return lookupHash;
    }

    DdIndex lookupResult() {
        return lookupResult;
    }

    // Allocation

    void reallocate(int tableSize) {
        if (!enabled) {
            return;
        }
        binaryKeyCount = keyCount(tableSize, configuration.cacheBinaryDivider());
        binaryOp = new byte[binaryKeyCount];
        binaryCache = new int[binaryKeyCount * 3];
        Arrays.fill(binaryCache, EMPTY);

        quantificationKeyCount = keyCount(tableSize, configuration.cacheQuantificationDivider());
        quantificationCache = new int[quantificationKeyCount * 2];
        Arrays.fill(quantificationCache, EMPTY);

        replaceKeyCount = keyCount(tableSize, configuration.cacheReplaceDivider());
        replaceCache = new int[replaceKeyCount * 2];
        Arrays.fill(replaceCache, EMPTY);

        repairKeyCount = keyCount(tableSize, configuration.cacheRepairDivider());
        repairCache = new int[repairKeyCount * 4];
        Arrays.fill(repairCache, EMPTY);

        binaryStatistics.invalidation();
        quantificationStatistics.invalidation();
        replaceStatistics.invalidation();
        repairStatistics.invalidation();
    }

    void invalidate() {
        logger.log(Level.FINE, "Invalidating all caches of {0}", this);
        Arrays.fill(binaryOp, NOT_AN_OPERATION);
        Arrays.fill(binaryCache, EMPTY);
        binaryStatistics.invalidation();
        clearQuantificationCache();
        clearReplaceCache();
        Arrays.fill(repairCache, EMPTY);
        repairStatistics.invalidation();
    }

    private void clearQuantificationCache() {
        quantificationStatistics.invalidation();
        Arrays.fill(quantificationCache, EMPTY);
    }

    private void clearReplaceCache() {
        replaceStatistics.invalidation();
        Arrays.fill(replaceCache, EMPTY);
    }

    // Binary operations

    boolean lookupAnd(DdIndex left, DdIndex right) {
        assert left.raw() <= right.raw();
        return binaryLookup(BINARY_OPERATION_AND, left, right);
    }

    void putAnd(int hash, DdIndex left, DdIndex right, DdIndex result) {
        assert left.raw() <= right.raw();
        binaryPut(BINARY_OPERATION_AND, hash, left, right, result);
    }

    private boolean binaryLookup(byte operation, DdIndex left, DdIndex right) {
        if (!enabled) {
            return false;
        }
        int hash = HashUtil.hash(operation, left.raw(), right.raw());
        lookupHash = hash;

        int cachePosition = HashUtil.mod(hash, binaryKeyCount);
        if (binaryOp[cachePosition] != operation) {
            return false;
        }
        int binStart = cachePosition * 3;
        int[] binaryCache = this.binaryCache;
        if (binaryCache[binStart] == left.raw() && binaryCache[binStart + 1] == right.raw()) {
            lookupResult = DdIndex.fromRaw(binaryCache[binStart + 2]);
            binaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    private void binaryPut(byte operation, int hash, DdIndex left, DdIndex right, DdIndex result) {
        if (!enabled) {
            return;
        }
        assert hash == HashUtil.hash(operation, left.raw(), right.raw());
        int cachePosition = HashUtil.mod(hash, binaryKeyCount);
        int binStart = cachePosition * 3;
        binaryOp[cachePosition] = operation;
        binaryCache[binStart] = left.raw();
        binaryCache[binStart + 1] = right.raw();
        binaryCache[binStart + 2] = result.raw();
        binaryStatistics.put();
    }

    // Quantification

    void initExists(VariableSet variables) {
        if (!enabled || variables.equals(quantificationSet)) {
            return;
        }
        quantificationSet = variables;
        clearQuantificationCache();
    }

    boolean lookupExists(DdIndex node) {
        assert quantificationSet != null || !enabled;
        return unaryLookup(quantificationCache, quantificationKeyCount, quantificationStatistics, node);
    }

    void putExists(int hash, DdIndex node, DdIndex result) {
        unaryPut(quantificationCache, quantificationKeyCount, quantificationStatistics, hash, node, result);
    }

    // Replacement

    void initReplace(VariableMap variableMap) {
        if (!enabled || variableMap.equals(replaceMap)) {
            return;
        }
        replaceMap = variableMap;
        clearReplaceCache();
    }

    boolean lookupReplace(DdIndex node) {
        assert replaceMap != null || !enabled;
        return unaryLookup(replaceCache, replaceKeyCount, replaceStatistics, node);
    }

    void putReplace(int hash, DdIndex node, DdIndex result) {
        unaryPut(replaceCache, replaceKeyCount, replaceStatistics, hash, node, result);
    }

    private boolean unaryLookup(int[] cache, int keyCount, CacheStatistics statistics, DdIndex node) {
        if (!enabled) {
            return false;
        }
        int hash = HashUtil.hash(node.raw());
        lookupHash = hash;

        int binStart = HashUtil.mod(hash, keyCount) * 2;
        if (cache[binStart] == node.raw()) {
            lookupResult = DdIndex.fromRaw(cache[binStart + 1]);
            statistics.cacheHit();
            return true;
        }
        return false;
    }

    private void unaryPut(
            int[] cache, int keyCount, CacheStatistics statistics, int hash, DdIndex node, DdIndex result) {
        if (!enabled) {
            return;
        }
        assert hash == HashUtil.hash(node.raw());
        int binStart = HashUtil.mod(hash, keyCount) * 2;
        cache[binStart] = node.raw();
        cache[binStart + 1] = result.raw();
        statistics.put();
    }

    // Order repair

    boolean lookupRepair(int level, DdIndex low, DdIndex high) {
        if (!enabled) {
            return false;
        }
        int hash = HashUtil.hash(level, low.raw(), high.raw());
        lookupHash = hash;

        int binStart = HashUtil.mod(hash, repairKeyCount) * 4;
        int[] repairCache = this.repairCache;
        if (repairCache[binStart] == level
                && repairCache[binStart + 1] == low.raw()
                && repairCache[binStart + 2] == high.raw()) {
            lookupResult = DdIndex.fromRaw(repairCache[binStart + 3]);
            repairStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putRepair(int hash, int level, DdIndex low, DdIndex high, DdIndex result) {
        if (!enabled) {
            return;
        }
        assert level >= 0 && hash == HashUtil.hash(level, low.raw(), high.raw());
        int binStart = HashUtil.mod(hash, repairKeyCount) * 4;
        repairCache[binStart] = level;
        repairCache[binStart + 1] = low.raw();
        repairCache[binStart + 2] = high.raw();
        repairCache[binStart + 3] = result.raw();
        repairStatistics.put();
    }

    // Statistics

    private static float loadFactor(int[] cache, int stride) {
        if (cache.length == 0) {
            return 0.0f;
        }
        int loadedBins = 0;
        for (int i = 0; i < cache.length; i += stride) {
            if (cache[i] != EMPTY) {
                loadedBins++;
            }
        }
        return (float) loadedBins / (float) (cache.length / stride);
    }

    String getStatistics() {
        if (!enabled) {
            return "Operation cache disabled";
        }
        return String.format(
                "Binary: size: %d, load: %3.3f%n %s%n"
                        + "Quantification: size: %d, load: %3.3f%n %s%n"
                        + "Replace: size: %d, load: %3.3f%n %s%n"
                        + "Repair: size: %d, load: %3.3f%n %s",
                binaryKeyCount,
                loadFactor(binaryCache, 3),
                binaryStatistics,
                quantificationKeyCount,
                loadFactor(quantificationCache, 2),
                quantificationStatistics,
                replaceKeyCount,
                loadFactor(replaceCache, 2),
                replaceStatistics,
                repairKeyCount,
                loadFactor(repairCache, 4),
                repairStatistics);
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int hitCountSinceInvalidation = 0;
        private int putCount = 0;
        private int putCountSinceInvalidation = 0;
        private int invalidationCount = 0;

        void cacheHit() {
            hitCount++;
            hitCountSinceInvalidation++;
        }

        void invalidation() {
            invalidationCount++;
            hitCountSinceInvalidation = 0;
            putCountSinceInvalidation = 0;
        }

        void put() {
            putCount++;
            putCountSinceInvalidation++;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format(
                    "Cache access: put=%d, hit=%d, hit-to-put=%3.3f%n"
                            + "       invalidation: %d times, since last: put=%d, hit=%d",
                    putCount,
                    hitCount,
                    hitToPutRatio,
                    invalidationCount,
                    putCountSinceInvalidation,
                    hitCountSinceInvalidation);
        }
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (OperationCache cache : cacheShutdownHook) {
                logger.info(cache.ownerStatistics.get());
                logger.info(cache.getStatistics());
            }
        }
    }
}
