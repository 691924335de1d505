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

import java.util.ArrayList;
import java.util.List;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class FormulaState {
    @Param({"8", "14"})
    private int depth;

    @Param({"4"})
    private int variableCount;

    private List<Variable> variables;
    private Formula formula;
    private Formula twin;
    private Environment environment;

    @Setup(Level.Iteration)
    public void setUpFormulas() {
        VariableIdGenerator ids = VariableIdGenerator.create();
        variables = new ArrayList<>(variableCount);
        ImmutableEnvironment.Builder builder = Environment.builder();
        for (int i = 0; i < variableCount; i++) {
            Variable variable = new Variable("x" + i, ids);
            variables.add(variable);
            builder.putValues(variable, (double) i);
        }
        environment = builder.build();
        formula = ladder(depth);
        twin = ladder(depth);
    }

    /**
     * Builds a balanced tree of alternating connectives over relational leaves. Two calls with the same
     * depth yield structurally equal but separately allocated formulas.
     */
    Formula ladder(int height) {
        if (height == 0) {
            Expression left = Expression.variable(variables.get(0));
            for (int i = 1; i < variables.size(); i++) {
                left = left.add(Expression.variable(variables.get(i)).multiply(i + 1.0));
            }
            return Formula.leq(left, Expression.constant(variables.size() * 10.0));
        }
        Formula child = ladder(height - 1);
        Formula sibling = Formula.not(ladder(height - 1));
        return height % 2 == 0 ? Formula.and(child, sibling) : Formula.or(child, sibling);
    }

    public int depth() {
        return depth;
    }

    public Formula formula() {
        return formula;
    }

    public Formula twin() {
        return twin;
    }

    public Environment environment() {
        return environment;
    }
}
