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
package com.hellblazer.zeckendorf;

import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import com.hellblazer.zeckendorf.common.Numeric;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZeckendorfTest {

    @Test
    public void testSequences() {
        assertEquals(BigInteger.valueOf(55), Zeckendorf.fibonacci(10));
        assertEquals(BigInteger.valueOf(123), Zeckendorf.lucas(10));
        assertEquals(BigInteger.valueOf(55), Zeckendorf.fibonacci(Numeric.real(10.0)));
        assertEquals(BigInteger.TWO, Zeckendorf.lucas(Numeric.parse("0")));
    }

    @Test
    public void testDecompositions() {
        assertEquals(List.of(11, 6, 4), Zeckendorf.decomposeZeckendorf(100).indices());
        assertEquals(List.of(11, 6, 4), Zeckendorf.decomposeZeckendorf(BigInteger.valueOf(100)).indices());
        assertEquals(List.of(11, 6, 4), Zeckendorf.decomposeZeckendorf(Numeric.parse("100")).indices());
        assertEquals(List.of(9, 6, 3, 0), Zeckendorf.decomposeLucas(100).indices());
        assertEquals(List.of(9, 6, 3, 0), Zeckendorf.decomposeLucas(Numeric.integral(100)).indices());
        assertEquals(List.of(3, 1), Zeckendorf.decomposeLucas(BigInteger.valueOf(5)).indices());
    }

    @Test
    public void testLiteralInputsAreNotRounded() {
        var exact = new BigInteger("12345678901234567891");
        var rep = Zeckendorf.decomposeZeckendorf(Numeric.parse("12345678901234567891.0"));
        assertEquals(exact, rep.n());
        assertEquals(exact, rep.sum());
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.fibonacci(Numeric.parse("3.0000000000000001")));
    }

    @Test
    public void testProfileAndScan() {
        var profile = Zeckendorf.cumulativeProfile(20);
        assertEquals(3, profile.s(20));
        assertEquals(profile, Zeckendorf.cumulativeProfile(Numeric.natural(20)));

        var scan = Zeckendorf.findEquilibria(20);
        assertEquals(List.of(0, 1, 2, 3, 6, 10, 17), scan.equilibriumIndices());
        assertEquals(scan, Zeckendorf.findEquilibria(Numeric.real(20.0)));
    }

    @Test
    public void testRejectsNonNaturalInputs() {
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.decomposeZeckendorf(-1));
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.decomposeZeckendorf(Numeric.real(2.5)));
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.decomposeLucas(Numeric.integral(-4)));
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.fibonacci(Numeric.complex(1.0, 1.0)));
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.findEquilibria(Numeric.natural(-1)));
        assertThrows(InvalidArgumentException.class, () -> Zeckendorf.cumulativeProfile(-1));
        assertThrows(NullPointerException.class, () -> Zeckendorf.lucas((Numeric) null));
    }
}
