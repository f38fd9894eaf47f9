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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class SyntheticBenchmark extends BaseBenchmark {
    @Benchmark
    public static void nQueens(ManagerState state, Blackhole bh) {
        bh.consume(ProblemBuilder.makeQueens(state.manager(), 8));
    }

    @Benchmark
    public static void binaryAdder(ManagerState state, Blackhole bh) {
        bh.consume(ProblemBuilder.makeAdder(state.manager(), 256));
    }
}
