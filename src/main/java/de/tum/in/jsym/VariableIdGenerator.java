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

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Source of variable identities. Each call to {@link #next()} returns a value that this generator
 * never returned before, also when called concurrently from several threads.
 *
 * <p>Variables created from different generators may share ids and then compare equal. Separate
 * generators are meant for isolated contexts (e.g. tests), all other code should use
 * {@link #global()}.</p>
 */
public final class VariableIdGenerator {
    private static final Logger logger = Logger.getLogger(VariableIdGenerator.class.getName());

    public static final long INITIAL_ID = 0L;

    private static final VariableIdGenerator GLOBAL = new VariableIdGenerator(INITIAL_ID);

    private final AtomicLong counter;

    private VariableIdGenerator(long start) {
        this.counter = new AtomicLong(start);
    }

    public static VariableIdGenerator global() {
        return GLOBAL;
    }

    public static VariableIdGenerator create() {
        return create(INITIAL_ID);
    }

    public static VariableIdGenerator create(long start) {
        logger.log(Level.FINE, "Creating variable id generator starting at {0}", start);
        return new VariableIdGenerator(start);
    }

    long next() {
        long id = counter.getAndIncrement();
        Util.checkState(id != Long.MAX_VALUE, "Variable ids exhausted");
        return id;
    }

    /**
     * Returns the id the next created variable will receive.
     */
    public long peek() {
        return counter.get();
    }

    @Override
    public String toString() {
        return String.format("VariableIdGenerator{next=%d}", counter.get());
    }
}
