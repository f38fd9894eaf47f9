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

import static de.tum.in.ddalgebra.Util.checkState;

import java.util.Arrays;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The unique table of a {@link DdManager}: stores nodes at stable positions and guarantees that
 * structurally equal nodes are stored only once.
 *
 * @param <N> The type of nodes.
 */
final class NodePool<N extends DdNode> {
    private static final Logger logger = Logger.getLogger(NodePool.class.getName());

    // Position 0 is reserved for the constants, which also makes it usable as "not a node"
    static final int NOT_A_NODE = 0;
    static final int FIRST_NODE = 1;

    private static final int MINIMUM_TABLE_SIZE = 7;
    private static final int MAXIMAL_TABLE_SIZE = DdIndex.MAXIMAL_POSITION;

    private final double growthFactor;
    private final IntConsumer resizeListener;

    /* Stored nodes, the slots from FIRST_NODE up to (excluding) nextFreeNode are occupied. Nodes are
     * never removed, hence free slots always form a suffix of the table. */
    private Object[] nodes;
    private int nextFreeNode;

    /* Hash map for existing nodes. When a node with a certain hash is created, we add it to the chain
     * starting at hashToChainStart[hash]. The chain is traversed by repeatedly following hashChain
     * until reaching NOT_A_NODE. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    NodePool(int initialSize, double growthFactor, IntConsumer resizeListener) {
        checkState(growthFactor > 1.0, "Invalid growth factor %s", growthFactor);
        this.growthFactor = growthFactor;
        this.resizeListener = resizeListener;

        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_TABLE_SIZE);
        nodes = new Object[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        nextFreeNode = FIRST_NODE;
    }

    /**
     * Returns the position of the stored node equal to {@code node}, storing it if necessary.
     */
    int findOrCreate(N node) {
        int hashCode = node.hashCode();
        Object[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (node.equals(nodes[currentLookupNode])) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextFreeNode == tableSize()) {
            grow();
        }

        int freeNode = nextFreeNode;
        nextFreeNode += 1;
        this.nodes[freeNode] = node;
        connectHashList(freeNode, hashCode);
        createdNodes += 1;
        return freeNode;
    }

    @SuppressWarnings("unchecked")
    N node(int position) {
        assert isValid(position) : "Invalid position " + position;
        return (N) nodes[position];
    }

    boolean isValid(int position) {
        return FIRST_NODE <= position && position < nextFreeNode;
    }

    /**
     * Number of stored nodes.
     */
    int size() {
        return nextFreeNode - FIRST_NODE;
    }

    int tableSize() {
        return nodes.length;
    }

    private void grow() {
        int oldSize = tableSize();
        checkState(oldSize < MAXIMAL_TABLE_SIZE, "Node pool exhausted at %d nodes", size());

        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = (int) Math.min(MAXIMAL_TABLE_SIZE, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;
        logger.log(Level.FINE, "Growing the node pool of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
        growCount += 1;

        nodes = Arrays.copyOf(nodes, newSize);
        // Chains depend on the table size and have to be re-built completely
        hashToChainStart = new int[newSize];
        hashChain = new int[newSize];
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            connectHashList(node, nodes[node].hashCode());
        }
        resizeListener.accept(newSize);
        logger.log(Level.FINE, "Finished growing the node pool");
    }

    private void connectHashList(int node, int hashCode) {
        assert isValid(node);
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        return HashUtil.mod(hashCode, nodes.length);
    }

    /**
     * Checks that every stored node is reachable through its hash chain and stored exactly once.
     */
    boolean check() {
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            Object stored = nodes[node];
            int current = hashToChainStart[hashToTable(stored.hashCode())];
            int found = NOT_A_NODE;
            while (current != NOT_A_NODE) {
                if (stored.equals(nodes[current])) {
                    checkState(found == NOT_A_NODE, "Node %s stored at %d and %d", stored, found, current);
                    found = current;
                }
                current = hashChain[current];
            }
            checkState(found == node, "Node %s at %d not found in its chain", stored, node);
        }
        return true;
    }

    String statistics() {
        return String.format(
                "Node pool: size=%d, stored=%d, created=%d, grown %d times%n"
                        + "Hash lookups: %d, hits: %d, average chain length: %3.3f",
                tableSize(),
                size(),
                createdNodes,
                growCount,
                hashChainLookups,
                hashChainLookupHit,
                (double) hashChainLookupLength / (double) Math.max(hashChainLookups, 1L));
    }
}
