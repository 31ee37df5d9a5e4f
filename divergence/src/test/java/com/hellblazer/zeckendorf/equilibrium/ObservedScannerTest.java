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
package com.hellblazer.zeckendorf.equilibrium;

import com.hellblazer.zeckendorf.divergence.DivergenceConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ObservedScannerTest {

    private final EquilibriumScanner scanner = new EquilibriumScanner(DivergenceConfig.sequential());

    @Test
    public void testRecordsOutcomes() {
        var store = new RecordingStore();
        var result = new ObservedScanner(scanner, store).scan(20);

        assertEquals(scanner.scan(20), result);
        assertEquals(result.points(), store.equilibria);
        assertEquals(List.of(0, 1, 2, 3, 6, 10, 17), store.signatures.get(ObservedScanner.LUCAS_BOUNDARY_SIGNATURE));
        assertEquals(List.of(5, 8, 9, 16), store.signatures.get("zero-without-lucas-boundary"));
        assertFalse(store.signatures.containsKey("lucas-boundary-without-zero"));
    }

    @Test
    public void testFailingStoreDoesNotAffectResult() {
        var failing = new PatternStore() {
            @Override
            public void storeEquilibrium(EquilibriumPoint point) {
                throw new IllegalStateException("store offline");
            }

            @Override
            public void storePatternSignature(String signature, List<Integer> exampleIds) {
                throw new IllegalStateException("store offline");
            }
        };
        assertEquals(scanner.scan(500), new ObservedScanner(scanner, failing).scan(500));
        assertEquals(scanner.scan(500), new ObservedScanner(scanner, PatternStore.discarding()).scan(500));
    }

    @Test
    public void testOneRejectedObservationKeepsTheRest() {
        var store = new RecordingStore() {
            @Override
            public void storeEquilibrium(EquilibriumPoint point) {
                if (point.n() == 2) {
                    throw new IllegalStateException("rejected " + point);
                }
                super.storeEquilibrium(point);
            }
        };
        var result = new ObservedScanner(scanner, store).scan(20);

        assertEquals(scanner.scan(20), result);
        assertEquals(List.of(0, 1, 3, 6, 10, 17), store.equilibria.stream().map(EquilibriumPoint::n).toList());
        assertEquals(List.of(0, 1, 2, 3, 6, 10, 17), store.signatures.get(ObservedScanner.LUCAS_BOUNDARY_SIGNATURE));
        assertEquals(List.of(5, 8, 9, 16), store.signatures.get("zero-without-lucas-boundary"));
    }

    @Test
    public void testSignatureNames() {
        assertEquals("zero-without-lucas-boundary",
                     ObservedScanner.signatureOf(Violation.Kind.ZERO_WITHOUT_LUCAS_BOUNDARY));
        assertEquals("lucas-boundary-without-zero",
                     ObservedScanner.signatureOf(Violation.Kind.LUCAS_BOUNDARY_WITHOUT_ZERO));
    }

    private static class RecordingStore implements PatternStore {
        final List<EquilibriumPoint>     equilibria = new ArrayList<>();
        final Map<String, List<Integer>> signatures = new LinkedHashMap<>();

        @Override
        public void storeEquilibrium(EquilibriumPoint point) {
            equilibria.add(point);
        }

        @Override
        public void storePatternSignature(String signature, List<Integer> exampleIds) {
            signatures.put(signature, exampleIds);
        }
    }
}
