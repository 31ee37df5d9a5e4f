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

import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DivergenceEnginesTest {

    @Test
    public void testEveryConfigurationAgrees() {
        var expected = new CumulativeDivergenceEngine().profile(4_000);
        var configs = new DivergenceConfig[] { DivergenceConfig.sequential(), DivergenceConfig.defaultConfig(),
                                               DivergenceConfig.defaultConfig()
                                                               .withParallelThreshold(1)
                                                               .withShardSize(333)
                                                               .withThreadCount(4),
                                               DivergenceConfig.highThroughput().withParallelThreshold(1_000) };
        for (var config : configs) {
            var engine = DivergenceEngines.forConfig(config);
            assertEquals(expected, engine.profile(4_000), config.toString());
            assertEquals(expected, engine.profile(BatchTables.forBound(4_000)), config.toString());
        }
    }

    @Test
    public void testConfigIsCopied() {
        var config = DivergenceConfig.defaultConfig().withParallelThreshold(1).withThreadCount(2).withShardSize(50);
        var engine = DivergenceEngines.forConfig(config);
        config.withShardSize(1);
        assertEquals(new CumulativeDivergenceEngine().profile(500), engine.profile(500));
    }

    @Test
    public void testBatchTables() {
        var tables = BatchTables.forBound(100);
        assertEquals(100, tables.bound());
        assertTrue(tables.fibonacci().covers(BigInteger.valueOf(101)));
        assertTrue(tables.lucas().covers(BigInteger.valueOf(101)));
        assertThrows(IllegalArgumentException.class,
                     () -> new BatchTables(10, tables.lucas(), tables.fibonacci()));
    }

    @Test
    public void testBatchTablesValidateBoundAndCoverage() {
        var fibonacci = SequenceTable.covering(SequenceKind.FIBONACCI, 1_000);
        var lucas = SequenceTable.covering(SequenceKind.LUCAS, 1_000);
        var negative = assertThrows(InvalidArgumentException.class, () -> new BatchTables(-1, fibonacci, lucas));
        assertEquals("bound", negative.getArgument());

        var shortFibonacci = SequenceTable.covering(SequenceKind.FIBONACCI, 10);
        var e = assertThrows(InvalidArgumentException.class, () -> new BatchTables(100, shortFibonacci, lucas));
        assertEquals("fibonacci", e.getArgument());
        var shortLucas = SequenceTable.covering(SequenceKind.LUCAS, 10);
        assertThrows(InvalidArgumentException.class, () -> new BatchTables(100, fibonacci, shortLucas));

        var exact = new BatchTables(1_000, fibonacci, lucas);
        assertEquals(new CumulativeDivergenceEngine().profile(1_000), new CumulativeDivergenceEngine().profile(exact));
    }
}
