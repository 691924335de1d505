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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class VariableTest {
    @Test
    public void testSameNameDistinctIdentity() {
        Variable x = new Variable("x");
        Variable xPrime = new Variable("x");
        assertThat(x.id(), is(not(xPrime.id())));
        assertThat(x.equals(xPrime), is(false));
        assertThat(x.name(), is(xPrime.name()));
        assertThat(x.toString(), is(xPrime.toString()));
    }

    @Test
    public void testReferenceCopyPreservesIdAndHash() {
        Variable x = new Variable("x");
        long id = x.id();
        int hash = x.hashCode();
        Variable copy = x;
        List<Variable> stored = ImmutableList.of(x);
        assertThat(copy.id(), is(id));
        assertThat(copy.hashCode(), is(hash));
        assertThat(stored.get(0).id(), is(id));
        assertThat(stored.get(0).hashCode(), is(hash));
    }

    @Test
    public void testOrder() {
        List<Variable> variables = ImmutableList.of(
                new Variable("x"), new Variable("y"), new Variable("z"), new Variable("w"));

        for (int i = 0; i < variables.size(); i++) {
            for (int j = 0; j < variables.size(); j++) {
                Variable left = variables.get(i);
                Variable right = variables.get(j);
                int comparison = left.compareTo(right);
                if (i < j) {
                    assertThat(comparison, lessThan(0));
                    assertThat(left.equals(right), is(false));
                } else if (i == j) {
                    assertThat(comparison, is(0));
                    assertThat(left.equals(right), is(true));
                } else {
                    assertThat(comparison, greaterThan(0));
                    assertThat(left.equals(right), is(false));
                }
            }
        }
    }

    @Test
    public void testToString() {
        assertThat(new Variable("x").toString(), is("x"));
        assertThat(new Variable("y").toString(), is("y"));
        assertThat(new Variable("").toString(), is(""));
    }

    @Test
    public void testIsolatedGenerator() {
        VariableIdGenerator generator = VariableIdGenerator.create(100L);
        Variable a = new Variable("a", generator);
        Variable b = new Variable("b", generator);
        assertThat(a.id(), is(100L));
        assertThat(b.id(), is(101L));
        assertThat(generator.peek(), is(102L));

        VariableIdGenerator other = VariableIdGenerator.create(100L);
        Variable c = new Variable("c", other);
        // Same id from a separate generator means same identity.
        assertThat(c.equals(a), is(true));
    }

    @Test
    public void testConcurrentCreationYieldsUniqueIds() throws Exception {
        VariableIdGenerator generator = VariableIdGenerator.create();
        int threads = 8;
        int perThread = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    List<Long> ids = new ArrayList<>(perThread);
                    for (int i = 0; i < perThread; i++) {
                        ids.add(new Variable("v", generator).id());
                    }
                    return ids;
                }));
            }
            Set<Long> ids = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                ids.addAll(future.get());
            }
            assertThat(ids.size(), is(threads * perThread));
            assertThat(generator.peek(), is((long) threads * perThread));
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }
}
