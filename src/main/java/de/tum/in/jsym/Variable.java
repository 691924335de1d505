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

import java.util.Objects;

/**
 * A symbolic variable. Two variables are equal iff they were created by the same constructor
 * call, i.e. they share the same id. The name is only used for display and need not be unique.
 */
public final class Variable implements Comparable<Variable> {
    private final long id;
    private final String name;
    private final int hash;

    public Variable(String name) {
        this(name, VariableIdGenerator.global());
    }

    public Variable(String name, VariableIdGenerator generator) {
        this.name = Objects.requireNonNull(name);
        this.id = generator.next();
        this.hash = HashUtil.hash(id);
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    @Override
    public int compareTo(Variable o) {
        return Long.compare(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        return id == ((Variable) o).id;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name;
    }
}
