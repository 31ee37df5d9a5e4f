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

import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZeckendorfCodecTest {

    private final ZeckendorfDecomposer decomposer = new ZeckendorfDecomposer();

    @Test
    public void testEncode() {
        assertEquals("1000010100", ZeckendorfCodec.encode(decomposer.decompose(100)));
        assertEquals("1", ZeckendorfCodec.encode(decomposer.decompose(1)));
        assertEquals("10", ZeckendorfCodec.encode(decomposer.decompose(2)));
        assertEquals("101", ZeckendorfCodec.encode(decomposer.decompose(4)));
        assertEquals("0", ZeckendorfCodec.encode(decomposer.decompose(0)));
    }

    @Test
    public void testDecode() {
        assertEquals(BigInteger.valueOf(100), ZeckendorfCodec.decode("1000010100"));
        assertEquals(BigInteger.valueOf(100), ZeckendorfCodec.decode("0001000010100"));
        assertEquals(BigInteger.ZERO, ZeckendorfCodec.decode("0"));
        assertEquals(List.of(11, 6, 4), ZeckendorfCodec.toRepresentation("1000010100").indices());
    }

    @Test
    public void testCodesAreDistinct() {
        var seen = new HashSet<String>();
        for (int n = 0; n <= 2_000; n++) {
            var code = ZeckendorfCodec.encode(decomposer.decompose(n));
            assertFalse(code.contains("11"), code);
            assertTrue(seen.add(code), "duplicate code " + code);
            assertEquals(BigInteger.valueOf(n), ZeckendorfCodec.decode(code));
        }
    }

    @Test
    public void testRejects() {
        assertThrows(InvalidArgumentException.class, () -> ZeckendorfCodec.decode(""));
        assertThrows(InvalidArgumentException.class, () -> ZeckendorfCodec.decode(null));
        assertThrows(InvalidArgumentException.class, () -> ZeckendorfCodec.decode("1021"));
        var e = assertThrows(InvalidArgumentException.class, () -> ZeckendorfCodec.decode("0110"));
        assertEquals("bits", e.getArgument());
        assertThrows(InvalidArgumentException.class,
                     () -> ZeckendorfCodec.encode(new LucasDecomposer().decompose(10)));
    }
}
