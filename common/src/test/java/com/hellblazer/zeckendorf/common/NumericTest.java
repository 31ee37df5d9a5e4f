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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tagged numeric variants and their exact narrowing.
 */
public class NumericTest {

    @Test
    public void testNaturalAcceptsZeroAndLargeValues() {
        assertEquals(BigInteger.ZERO, Numeric.natural(0).value());
        var big = BigInteger.TWO.pow(200);
        assertEquals(big, Numeric.natural(big).value());
        assertSame(Numeric.Natural.ZERO, Numeric.Natural.ZERO.asNatural());
    }

    @Test
    public void testNaturalRejectsNegative() {
        var e = assertThrows(InvalidArgumentException.class, () -> Numeric.natural(-1));
        assertEquals("value", e.getArgument());
    }

    @Test
    public void testIntegralNarrowing() {
        assertEquals(BigInteger.valueOf(7), Numeric.integral(7).asNatural().value());
        assertThrows(InvalidArgumentException.class, () -> Numeric.integral(-7).asNatural());
    }

    @Test
    @DisplayName("Real narrows only when integral and non-negative")
    public void testRealNarrowing() {
        assertEquals(BigInteger.valueOf(12), Numeric.real(12.0).asNatural().value());
        assertTrue(Numeric.real(3.0).isIntegral());
        assertFalse(Numeric.real(3.5).isIntegral());
        assertThrows(InvalidArgumentException.class, () -> Numeric.real(3.5).asNatural());
        assertThrows(InvalidArgumentException.class, () -> Numeric.real(-2.0).asNatural());
    }

    @ParameterizedTest
    @ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
    public void testRealRejectsNonFinite(double value) {
        assertThrows(InvalidArgumentException.class, () -> Numeric.real(value));
    }

    @Test
    public void testComplexNarrowing() {
        assertEquals(BigInteger.valueOf(4), Numeric.complex(4.0, 0.0).asNatural().value());
        assertThrows(InvalidArgumentException.class, () -> Numeric.complex(4.0, 1.0).asNatural());
        assertThrows(InvalidArgumentException.class, () -> Numeric.complex(Double.NaN, 0.0));

        var c = Numeric.complex(3.0, 4.0);
        assertEquals(5.0, c.magnitude(), 1e-12);
        assertEquals(-4.0, c.conjugate().imaginary());
    }

    @Test
    public void testParsePicksNarrowestVariant() {
        assertInstanceOf(Numeric.Natural.class, Numeric.parse("42"));
        assertInstanceOf(Numeric.Integral.class, Numeric.parse("-42"));
        assertInstanceOf(Numeric.Real.class, Numeric.parse("4.2"));
        assertEquals(new BigInteger("123456789012345678901234567890"),
                     ((Numeric.Natural) Numeric.parse(" 123456789012345678901234567890 ")).value());
    }

    @Test
    public void testParseIsExact() {
        var large = Numeric.parse("12345678901234567891.0");
        assertInstanceOf(Numeric.Natural.class, large);
        assertEquals(new BigInteger("12345678901234567891"), large.asNatural().value());
        assertEquals(BigInteger.valueOf(1000), Numeric.parse("1e3").asNatural().value());
        assertEquals(new Numeric.Integral(BigInteger.valueOf(-7)), Numeric.parse("-7.00"));
        assertEquals(Numeric.Natural.ZERO, Numeric.parse("0.000"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "3.0000000000000001", "1e-400", "-2.00000000000000000001" })
    public void testParseRejectsFractionsThatRoundToIntegers(String literal) {
        var e = assertThrows(InvalidArgumentException.class, () -> Numeric.parse(literal));
        assertEquals("literal", e.getArgument());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "abc", "1..2" })
    public void testParseRejectsGarbage(String literal) {
        assertThrows(InvalidArgumentException.class, () -> Numeric.parse(literal));
    }

    @Test
    public void testIndexConversions() {
        assertEquals(99, Numeric.natural(99).intValueExact("n"));
        assertEquals(Long.MAX_VALUE, Numeric.natural(Long.MAX_VALUE).longValueExact("n"));
        var tooBig = Numeric.natural(BigInteger.valueOf(Integer.MAX_VALUE).add(BigInteger.ONE));
        var e = assertThrows(InvalidArgumentException.class, () -> tooBig.intValueExact("n"));
        assertEquals("n", e.getArgument());
        assertThrows(InvalidArgumentException.class,
                     () -> Numeric.natural(BigInteger.TWO.pow(64)).longValueExact("n"));
    }
}
