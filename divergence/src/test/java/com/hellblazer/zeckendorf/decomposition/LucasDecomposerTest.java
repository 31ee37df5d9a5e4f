/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Zeckendorf.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.zeckendorf.decomposition;

import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;
import com.hellblazer.zeckendorf.sequence.Sequences;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LucasDecomposerTest {

    private final LucasDecomposer decomposer = new LucasDecomposer();

    @Test
    public void testKnownDecompositions() {
        var hundred = decomposer.decompose(100);
        assertEquals(SequenceKind.LUCAS, hundred.basis());
        assertEquals(List.of(9, 6, 3, 0), hundred.indices());
        assertEquals("100 = L(9) + L(6) + L(3) + L(0) = 76 + 18 + 4 + 2", hundred.toString());
        assertEquals(List.of(3, 1), decomposer.decompose(5).indices());
        assertEquals(List.of(0), decomposer.decompose(2).indices());
        assertEquals(List.of(1), decomposer.decompose(1).indices());
        assertEquals(List.of(14, 10, 7, 3, 1), decomposer.decompose(1_000).indices());
        assertTrue(decomposer.decompose(0).isEmpty());
    }

    @Test
    public void testSmallCounts() {
        int[] expected = { 0, 1, 1, 1, 1, 2, 2, 1, 2, 2, 2, 1 };
        for (int n = 0; n < expected.length; n++) {
            assertEquals(expected[n], decomposer.count(n), "l(" + n + ")");
        }
    }

    @Test
    public void testInvariants() {
        var shared = new LucasDecomposer(SequenceTable.covering(SequenceKind.LUCAS, 100_000), false);
        for (int n = 0; n <= 100_000; n++) {
            var rep = shared.decompose(n);
            assertTrue(rep.isValid(), () -> rep + " " + rep.invariantViolations());
            assertFalse(rep.contains(0) && rep.contains(2), "L(0) with L(2) for " + n);
        }
    }

    @Test
    public void testLucasNumbersAreSingleTerms() {
        for (int m = 0; m <= 150; m++) {
            var rep = decomposer.decompose(Sequences.lucas(m));
            assertEquals(List.of(m), rep.indices(), "L(" + m + ")");
        }
    }

    /**
     * Every n below L(12) has exactly one admissible set of Lucas indices, and it is the greedy one.
     */
    @Test
    public void testUniqueness() {
        var lucas = Sequences.lucasSequence(11);
        Map<Integer, List<List<Integer>>> byValue = new HashMap<>();
        enumerate(lucas, 11, new ArrayList<>(), 0, byValue);
        int limit = lucas[11].add(lucas[10]).intValueExact();
        for (int n = 0; n < limit; n++) {
            var reps = byValue.getOrDefault(n, List.of());
            assertEquals(1, reps.size(), "admissible representations of " + n + ": " + reps);
            assertEquals(reps.get(0), decomposer.decompose(n).indices());
        }
    }

    private static void enumerate(BigInteger[] lucas, int highest, List<Integer> chosen, int sum,
                                  Map<Integer, List<List<Integer>>> byValue) {
        byValue.computeIfAbsent(sum, k -> new ArrayList<>()).add(List.copyOf(chosen));
        for (int index = highest; index >= 0; index--) {
            if (index == 0 && chosen.contains(2)) {
                continue;
            }
            chosen.add(index);
            enumerate(lucas, index - 2, chosen, sum + lucas[index].intValueExact(), byValue);
            chosen.remove(chosen.size() - 1);
        }
    }

    @Test
    public void testBrokenRepresentationIsReported() {
        var broken = new Representation(BigInteger.valueOf(5), SequenceKind.LUCAS, List.of(2, 0),
                                        List.of(BigInteger.valueOf(3), BigInteger.TWO));
        assertFalse(broken.isValid());
        assertEquals(1, broken.invariantViolations().size());

        var adjacent = new Representation(BigInteger.valueOf(7), SequenceKind.LUCAS, List.of(3, 2),
                                          List.of(BigInteger.valueOf(4), BigInteger.valueOf(3)));
        assertFalse(adjacent.isValid());
    }
}
