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
package com.hellblazer.zeckendorf.divergence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ParallelDivergenceEngineTest {

    private final CumulativeDivergenceEngine sequential = new CumulativeDivergenceEngine();

    @ParameterizedTest
    @CsvSource({ "0, 1, 4", "1, 1, 2", "10, 3, 4", "1000, 64, 4", "1000, 1001, 2", "20000, 777, 8" })
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testMatchesSequential(int bound, int shardSize, int threads) {
        var config = DivergenceConfig.defaultConfig().withShardSize(shardSize).withThreadCount(threads);
        var parallel = new ParallelDivergenceEngine(config);
        assertEquals(sequential.profile(bound), parallel.profile(bound));
    }

    @Test
    public void testSharedTables() {
        var tables = BatchTables.forBound(5_000);
        var parallel = new ParallelDivergenceEngine(DivergenceConfig.defaultConfig().withShardSize(500));
        assertEquals(sequential.profile(tables), parallel.profile(tables));
    }

    @Test
    public void testRepeatable() {
        var parallel = new ParallelDivergenceEngine(
        DivergenceConfig.highThroughput().withShardSize(100).withThreadCount(4));
        var first = parallel.profile(3_000);
        assertEquals(first, parallel.profile(3_000));
        assertEquals(1, first.s(4));
    }

    @Test
    public void testCancellation() {
        var parallel = new ParallelDivergenceEngine(DivergenceConfig.defaultConfig().withShardSize(10));
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> parallel.profile(10_000));
        } finally {
            Thread.interrupted();
        }
    }
}
