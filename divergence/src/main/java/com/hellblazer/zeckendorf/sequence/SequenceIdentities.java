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
package com.hellblazer.zeckendorf.sequence;

import com.hellblazer.zeckendorf.common.Arguments;
import com.hellblazer.zeckendorf.common.InvalidArgumentException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.zeckendorf.sequence.Sequences.fibonacci;
import static com.hellblazer.zeckendorf.sequence.Sequences.lucas;

/**
 * Classical Fibonacci and Lucas identities, evaluated exactly. Useful as an independent consistency check of the
 * generator: each identity mixes values from different indices, so an off-by-one or a sign error in either access
 * mode shows up here.
 *
 * @author hal.hildebrand
 */
public final class SequenceIdentities {

    private static final BigInteger FIVE = BigInteger.valueOf(5);

    private SequenceIdentities() {
    }

    /**
     * F(n-1)F(n+1) - F(n)^2 = (-1)^n, n &gt;= 1.
     */
    public static IdentityCheck cassini(long n) {
        requireAtLeastOne(n);
        var left = fibonacci(n - 1).multiply(fibonacci(n + 1)).subtract(fibonacci(n).pow(2));
        return new IdentityCheck("cassini", n, left, signOf(n));
    }

    /**
     * F(2n) = F(n)(2F(n+1) - F(n)).
     */
    public static IdentityCheck fibonacciDoubling(long n) {
        Arguments.requireNatural(n, "n");
        var fn = fibonacci(n);
        var right = fn.multiply(fibonacci(n + 1).shiftLeft(1).subtract(fn));
        return new IdentityCheck("fibonacci-doubling", n, fibonacci(2 * n), right);
    }

    /**
     * F(0) + ... + F(n) = F(n+2) - 1.
     */
    public static IdentityCheck fibonacciSum(int n) {
        Arguments.requireRange(n, "n");
        var sum = BigInteger.ZERO;
        for (var value : Sequences.fibonacciSequence(n)) {
            sum = sum.add(value);
        }
        return new IdentityCheck("fibonacci-sum", n, sum, fibonacci(n + 2L).subtract(BigInteger.ONE));
    }

    /**
     * L(n) = F(n-1) + F(n+1), n &gt;= 1.
     */
    public static IdentityCheck lucasFibonacciRelation(long n) {
        requireAtLeastOne(n);
        return new IdentityCheck("lucas-fibonacci", n, lucas(n), fibonacci(n - 1).add(fibonacci(n + 1)));
    }

    /**
     * L(n) = F(n) + 2F(n-1), n &gt;= 1.
     */
    public static IdentityCheck lucasAlternativeRelation(long n) {
        requireAtLeastOne(n);
        return new IdentityCheck("lucas-alternative", n, lucas(n), fibonacci(n).add(fibonacci(n - 1).shiftLeft(1)));
    }

    /**
     * L(n)^2 - 5F(n)^2 = 4(-1)^n.
     */
    public static IdentityCheck lucasSquare(long n) {
        Arguments.requireNatural(n, "n");
        var left = lucas(n).pow(2).subtract(FIVE.multiply(fibonacci(n).pow(2)));
        return new IdentityCheck("lucas-square", n, left, signOf(n).shiftLeft(2));
    }

    /**
     * L(2n) = L(n)^2 - 2(-1)^n.
     */
    public static IdentityCheck lucasDoubling(long n) {
        Arguments.requireNatural(n, "n");
        var right = lucas(n).pow(2).subtract(signOf(n).shiftLeft(1));
        return new IdentityCheck("lucas-doubling", n, lucas(2 * n), right);
    }

    /**
     * F(2n) = F(n)L(n).
     */
    public static IdentityCheck fibonacciLucasProduct(long n) {
        Arguments.requireNatural(n, "n");
        return new IdentityCheck("fibonacci-lucas-product", n, fibonacci(2 * n), fibonacci(n).multiply(lucas(n)));
    }

    /**
     * Every identity applicable at n.
     */
    public static List<IdentityCheck> verifyAll(int n) {
        Arguments.requireNatural(n, "n");
        var checks = new ArrayList<IdentityCheck>();
        if (n >= 1) {
            checks.add(cassini(n));
            checks.add(lucasFibonacciRelation(n));
            checks.add(lucasAlternativeRelation(n));
        }
        checks.add(fibonacciDoubling(n));
        checks.add(fibonacciSum(n));
        checks.add(lucasSquare(n));
        checks.add(lucasDoubling(n));
        checks.add(fibonacciLucasProduct(n));
        return checks;
    }

    private static BigInteger signOf(long n) {
        return (n & 1L) == 0 ? BigInteger.ONE : BigInteger.ONE.negate();
    }

    private static void requireAtLeastOne(long n) {
        if (n < 1) {
            throw new InvalidArgumentException("n", "must be at least 1, got " + n);
        }
    }
}
