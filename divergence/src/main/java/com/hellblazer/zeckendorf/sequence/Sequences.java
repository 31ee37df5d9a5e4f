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
import java.util.Objects;

/**
 * Exact Fibonacci and Lucas values.
 * <p>
 * Two access modes are provided:
 * <ul>
 * <li>dense forward generation of value(0..N), O(N) additions in total</li>
 * <li>sparse random access in O(log n) multiplications by fast doubling, stepping from (value(k), value(k+1)) to
 * (value(2k), value(2k+1)) or (value(2k+1), value(2k+2)) for each bit of n, most significant first</li>
 * </ul>
 * Fast doubling identities used:
 * <pre>
 *   F(2k)   = F(k) * (2F(k+1) - F(k))          L(2k)   = L(k)^2 - 2(-1)^k
 *   F(2k+1) = F(k)^2 + F(k+1)^2                L(2k+1) = L(k)L(k+1) - (-1)^k
 * </pre>
 * All values are {@link BigInteger}; nothing is derived from floating point.
 *
 * @author hal.hildebrand
 */
public final class Sequences {

    /**
     * Largest index accepted by random access. F(n) has roughly 0.694n bits, so this keeps every value inside the
     * range a {@link BigInteger} can represent.
     */
    public static final long MAX_INDEX = Integer.MAX_VALUE;

    private static final BigInteger FIVE = BigInteger.valueOf(5);

    private Sequences() {
    }

    public static BigInteger fibonacci(long n) {
        checkIndex(n);
        return fibonacciPair(n)[0];
    }

    public static BigInteger lucas(long n) {
        checkIndex(n);
        return lucasPair(n)[0];
    }

    public static BigInteger value(SequenceKind kind, long n) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return switch (kind) {
            case FIBONACCI -> fibonacci(n);
            case LUCAS -> lucas(n);
        };
    }

    /**
     * F(0) .. F(N) by forward recurrence.
     */
    public static BigInteger[] fibonacciSequence(int bound) {
        return sequence(SequenceKind.FIBONACCI, bound);
    }

    /**
     * L(0) .. L(N) by forward recurrence.
     */
    public static BigInteger[] lucasSequence(int bound) {
        return sequence(SequenceKind.LUCAS, bound);
    }

    public static BigInteger[] sequence(SequenceKind kind, int bound) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Arguments.requireRange(bound, "N");
        var values = new BigInteger[bound + 1];
        values[0] = kind.seed0();
        if (bound >= 1) {
            values[1] = kind.seed1();
        }
        for (int i = 2; i <= bound; i++) {
            values[i] = values[i - 1].add(values[i - 2]);
        }
        return values;
    }

    /**
     * True if the value is F(i) for some i. Uses the classical test: v is Fibonacci iff 5v^2 + 4 or 5v^2 - 4 is a
     * perfect square.
     */
    public static boolean isFibonacci(BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            return false;
        }
        var fiveSquared = value.multiply(value).multiply(FIVE);
        return isPerfectSquare(fiveSquared.add(BigInteger.valueOf(4))) || isPerfectSquare(
        fiveSquared.subtract(BigInteger.valueOf(4)));
    }

    public static boolean isLucas(BigInteger value) {
        return lucasIndexOf(value) >= 0;
    }

    /**
     * The index m with L(m) = value, or -1 if the value is not a Lucas number. Walks the sequence forward, which is
     * O(log value) steps since the terms grow geometrically.
     */
    public static int lucasIndexOf(BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.equals(BigInteger.TWO)) {
            return 0;
        }
        if (value.equals(BigInteger.ONE)) {
            return 1;
        }
        var previous = BigInteger.ONE;
        var current = BigInteger.valueOf(3);
        int index = 2;
        while (current.compareTo(value) < 0) {
            var next = previous.add(current);
            previous = current;
            current = next;
            index++;
        }
        return current.equals(value) ? index : -1;
    }

    /**
     * {F(n), F(n+1)} by fast doubling.
     */
    static BigInteger[] fibonacciPair(long n) {
        var a = BigInteger.ZERO;
        var b = BigInteger.ONE;
        for (int bit = highestBit(n); bit >= 0; bit--) {
            var doubled = a.multiply(b.shiftLeft(1).subtract(a));
            var doubledPlusOne = a.multiply(a).add(b.multiply(b));
            if (((n >>> bit) & 1L) == 0) {
                a = doubled;
                b = doubledPlusOne;
            } else {
                a = doubledPlusOne;
                b = doubled.add(doubledPlusOne);
            }
        }
        return new BigInteger[] { a, b };
    }

    /**
     * {L(n), L(n+1)} by fast doubling. The (-1)^k terms depend only on the parity of the current k, which is the last
     * bit consumed.
     */
    static BigInteger[] lucasPair(long n) {
        var a = BigInteger.TWO;
        var b = BigInteger.ONE;
        boolean odd = false;
        for (int bit = highestBit(n); bit >= 0; bit--) {
            var sign = odd ? BigInteger.ONE.negate() : BigInteger.ONE;
            var doubled = a.multiply(a).subtract(sign.shiftLeft(1));
            var doubledPlusOne = a.multiply(b).subtract(sign);
            if (((n >>> bit) & 1L) == 0) {
                a = doubled;
                b = doubledPlusOne;
                odd = false;
            } else {
                a = doubledPlusOne;
                b = b.multiply(b).add(sign.shiftLeft(1));
                odd = true;
            }
        }
        return new BigInteger[] { a, b };
    }

    private static int highestBit(long n) {
        return n == 0 ? -1 : 63 - Long.numberOfLeadingZeros(n);
    }

    private static boolean isPerfectSquare(BigInteger value) {
        if (value.signum() < 0) {
            return false;
        }
        var root = value.sqrt();
        return root.multiply(root).equals(value);
    }

    private static void checkIndex(long n) {
        Arguments.requireNatural(n, "n");
        if (n > MAX_INDEX) {
            throw new InvalidArgumentException("n", "index " + n + " exceeds maximum " + MAX_INDEX);
        }
    }
}
