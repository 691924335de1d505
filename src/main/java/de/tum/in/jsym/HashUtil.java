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

final class HashUtil {
    // Golden ratio constant used by the usual seed combiner.
    static final int GOLDEN_RATIO = 0x9e3779b9;

    private HashUtil() {}

    /**
     * Mixes {@code value} into {@code seed}. The result depends on the order of combination, i.e.
     * {@code combine(combine(s, a), b)} and {@code combine(combine(s, b), a)} differ in general.
     */
    static int combine(int seed, int value) {
        return seed ^ (value + GOLDEN_RATIO + (seed << 6) + (seed >>> 2));
    }

    static int hash(long key) {
        return Long.hashCode(key);
    }

    static int hash(double key) {
        return Double.hashCode(key);
    }
}
