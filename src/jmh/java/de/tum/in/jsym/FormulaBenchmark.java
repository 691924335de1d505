/*
 * This file is part of JSym.
 * Copyright (c) 2026 The JSym authors.
 *
 * JSym is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JSym is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JSym. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jsym;

import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class FormulaBenchmark {
    @Benchmark
    public static void construct(FormulaState state, Blackhole bh) {
        bh.consume(state.ladder(state.depth()));
    }

    @Benchmark
    public static void structuralEquality(FormulaState state, Blackhole bh) {
        bh.consume(state.formula().equalTo(state.twin()));
    }

    @Benchmark
    public static void evaluate(FormulaState state, Blackhole bh) {
        bh.consume(state.formula().evaluate(state.environment()));
    }

    @Benchmark
    public static void freeVariables(FormulaState state, Blackhole bh) {
        bh.consume(state.formula().freeVariables());
    }

    @Benchmark
    public static void display(FormulaState state, Blackhole bh) {
        bh.consume(state.formula().toString());
    }
}
