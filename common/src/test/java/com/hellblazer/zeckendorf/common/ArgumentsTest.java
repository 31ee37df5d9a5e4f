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
package com.hellblazer.zeckendorf.common;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentsTest {

    @Test
    public void testRequireNatural() {
        assertEquals(0L, Arguments.requireNatural(0L, "n"));
        assertEquals(BigInteger.TEN, Arguments.requireNatural(BigInteger.TEN, "n"));

        var e = assertThrows(InvalidArgumentException.class, () -> Arguments.requireNatural(-5L, "n"));
        assertEquals("n", e.getArgument());
        assertTrue(e.getMessage().contains("-5"));
        assertThrows(InvalidArgumentException.class, () -> Arguments.requireNatural(BigInteger.valueOf(-1), "n"));
        assertThrows(NullPointerException.class, () -> Arguments.requireNatural(null, "n"));
    }

    @Test
    public void testRequireRange() {
        assertEquals(0, Arguments.requireRange(0, "N"));
        assertEquals(Arguments.MAX_RANGE, Arguments.requireRange(Arguments.MAX_RANGE, "N"));
        assertThrows(InvalidArgumentException.class, () -> Arguments.requireRange(-1, "N"));
        assertThrows(InvalidArgumentException.class, () -> Arguments.requireRange(Arguments.MAX_RANGE + 1L, "N"));
    }

    @Test
    public void testRequirePositive() {
        assertEquals(3, Arguments.requirePositive(3, "shardSize"));
        assertThrows(InvalidArgumentException.class, () -> Arguments.requirePositive(0, "shardSize"));
    }
}
