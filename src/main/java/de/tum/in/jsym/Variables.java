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

import java.util.Collections;
import java.util.Iterator;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A set of {@link Variable}s, ordered by id. Iteration, display and hashing follow this order, so
 * two sets with the same members behave identically regardless of how they were built.
 *
 * <p>Instances are mutable through {@link #insert(Variable)}, {@link #insertAll(Iterable)} and
 * {@link #erase(Variable)}, all other operations are pure. Not thread-safe.</p>
 */
public final class Variables implements Iterable<Variable> {
    private final NavigableSet<Variable> variables;

    public Variables() {
        this.variables = new TreeSet<>();
    }

    private Variables(NavigableSet<Variable> variables) {
        this.variables = variables;
    }

    public static Variables of(Variable... variables) {
        Variables set = new Variables();
        for (Variable variable : variables) {
            set.insert(variable);
        }
        return set;
    }

    public static Variables copyOf(Iterable<Variable> variables) {
        Variables set = new Variables();
        set.insertAll(variables);
        return set;
    }

    /**
     * Adds {@code variable} to this set. Does nothing if a variable with the same id is present.
     *
     * @return whether the set changed
     */
    public boolean insert(Variable variable) {
        return variables.add(Objects.requireNonNull(variable));
    }

    public void insertAll(Iterable<Variable> other) {
        for (Variable variable : other) {
            insert(variable);
        }
    }

    public boolean erase(Variable variable) {
        return variables.remove(variable);
    }

    public boolean contains(Variable variable) {
        return variables.contains(variable);
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    /** Set union. */
    public Variables plus(Variables other) {
        Variables union = copyOf(this);
        union.insertAll(other);
        return union;
    }

    public Variables plus(Variable variable) {
        Variables union = copyOf(this);
        union.insert(variable);
        return union;
    }

    /** Set difference. */
    public Variables minus(Variables other) {
        NavigableSet<Variable> difference = new TreeSet<>(variables);
        difference.removeAll(other.variables);
        return new Variables(difference);
    }

    public Variables minus(Variable variable) {
        Variables difference = copyOf(this);
        difference.erase(variable);
        return difference;
    }

    public Variables intersect(Variables other) {
        NavigableSet<Variable> intersection = new TreeSet<>(variables);
        intersection.retainAll(other.variables);
        return new Variables(intersection);
    }

    public boolean isSubsetOf(Variables other) {
        return other.variables.containsAll(variables);
    }

    public boolean isSupersetOf(Variables other) {
        return other.isSubsetOf(this);
    }

    public boolean isStrictSubsetOf(Variables other) {
        return size() < other.size() && isSubsetOf(other);
    }

    public boolean isStrictSupersetOf(Variables other) {
        return other.isStrictSubsetOf(this);
    }

    public Stream<Variable> stream() {
        return variables.stream();
    }

    @Override
    public Iterator<Variable> iterator() {
        return Collections.unmodifiableSet(variables).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variables)) {
            return false;
        }
        return variables.equals(((Variables) o).variables);
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Variable variable : variables) {
            hash = HashUtil.combine(hash, variable.hashCode());
        }
        return hash;
    }

    @Override
    public String toString() {
        return stream().map(Variable::name).collect(Collectors.joining(", ", "{", "}"));
    }
}
