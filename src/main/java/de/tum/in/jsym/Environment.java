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

import java.util.Map;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * An assignment of numeric values to variables, used to evaluate expressions and formulas.
 */
@Value.Immutable
public abstract class Environment {
    @Value.Parameter
    public abstract Map<Variable, Double> values();

    public static Environment fromValues(Map<Variable, Double> values) {
        return ImmutableEnvironment.of(values);
    }

    public static Environment empty() {
        return ImmutableEnvironment.builder().build();
    }

    public static ImmutableEnvironment.Builder builder() {
        return ImmutableEnvironment.builder();
    }

    @Value.Check
    protected void check() {
        values().forEach((variable, value) ->
                Util.checkState(!Double.isNaN(value), "NaN is assigned to variable %s", variable));
    }

    /**
     * Returns the value assigned to {@code variable}.
     *
     * @throws IllegalArgumentException if the variable is not assigned.
     */
    public double get(Variable variable) {
        Double value = find(variable);
        Util.checkArgument(value != null, "Variable %s (id %d) is not assigned in %s",
                variable, variable.id(), domain());
        return value;
    }

    @Nullable
    public Double find(Variable variable) {
        return values().get(variable);
    }

    public boolean contains(Variable variable) {
        return values().containsKey(variable);
    }

    public Variables domain() {
        return Variables.copyOf(values().keySet());
    }

    public int size() {
        return values().size();
    }
}
