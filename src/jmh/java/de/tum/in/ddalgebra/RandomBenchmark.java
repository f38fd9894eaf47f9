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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

public class RandomBenchmark extends BaseBenchmark {
    private static final int VARIABLES = 32;
    private static final int WINDOW = 10;

    @SuppressWarnings("StaticCollection")
    private static final List<Operation> OPERATION_LIST = List.of(
            n -> n.add(n.manager.not(n.get())),
            n -> n.add(n.manager.and(n.get(), n.get())),
            n -> n.add(n.manager.or(n.get(), n.get())),
            n -> n.add(n.manager.xor(n.get(), n.get())),
            n -> n.add(n.manager.implies(n.get(), n.get())),
            n -> n.add(n.manager.ite(n.get(), n.get(), n.get())),
            n -> {
                BitSet set = new BitSet(VARIABLES);
                for (int i = 0; i < WINDOW; i++) {
                    if (n.random.nextBoolean()) {
                        set.set(n.random.nextInt(VARIABLES));
                    }
                }
                n.add(n.manager.exists(n.get(), VariableSet.of(set)));
            },
            n -> {
                int[] replacement = new int[VARIABLES];
                for (int i = 0; i < VARIABLES; i++) {
                    replacement[i] = n.random.nextInt(4) == 0 ? n.random.nextInt(VARIABLES) : -1;
                }
                n.add(n.manager.replace(n.get(), VariableMap.of(replacement)));
            },
            n -> {
                int first = n.random.nextInt(VARIABLES);
                n.add(n.manager.replace(n.get(), VariableMap.swap(first, (first + 1) % VARIABLES)));
            },
            n -> n.manager.countSatisfyingAssignments(n.get()));

    @FunctionalInterface
    private interface Operation {
        void run(Nodes nodes);
    }

    public static class Nodes {
        public final DdManager<BddNode> manager;
        public final Random random;
        private final List<DdIndex> nodes = new ArrayList<>();

        public Nodes(DdManager<BddNode> manager, Random random) {
            this.manager = manager;
            this.random = random;
        }

        public void createVariables(int count) {
            for (DdIndex variable : manager.createVariables(count)) {
                nodes.add(variable);
                nodes.add(manager.not(variable));
            }
        }

        public void add(DdIndex node) {
            // Keep the working set small, otherwise operands quickly become huge
            if (nodes.size() > 200) {
                nodes.subList(0, 100).clear();
            }
            nodes.add(node);
        }

        public DdIndex get() {
            return nodes.get(random.nextInt(nodes.size()));
        }
    }

    private static List<Operation> makeOperations(int count, Random random) {
        List<Operation> operations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            operations.add(OPERATION_LIST.get(random.nextInt(OPERATION_LIST.size())));
        }
        return operations;
    }

    @State(Scope.Benchmark)
    public static class RandomState extends ManagerState {
        private static final int SEED = 1234;
        private static final int OPERATION_COUNT = 20_000;

        public Nodes nodes;
        public List<Operation> operations;

        @Setup(Level.Trial)
        public void setUpOperations() {
            operations = makeOperations(OPERATION_COUNT, new Random(SEED));
        }

        @Override
        @Setup(Level.Iteration)
        public void setUpManager() {
            super.setUpManager();
            nodes = new Nodes(manager(), new Random(SEED));
            nodes.createVariables(VARIABLES);
        }
    }

    @Benchmark
    public static void benchmarkRandom(RandomState state, Blackhole bh) {
        for (Operation operation : state.operations) {
            operation.run(state.nodes);
        }
        bh.consume(state.nodes.get());
    }
}
