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

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable 2x2 integer matrix, used for the Q-matrix formulation
 * <pre>
 *   Q^n = | F(n+1)  F(n)   |      Q = | 1 1 |
 *         | F(n)    F(n-1) |          | 1 0 |
 * </pre>
 * Exponentiation by squaring gives an O(log n) route to F(n) that is independent of fast doubling.
 *
 * @author hal.hildebrand
 */
public record QMatrix(BigInteger a, BigInteger b, BigInteger c, BigInteger d) {

    public static final QMatrix IDENTITY = new QMatrix(BigInteger.ONE, BigInteger.ZERO, BigInteger.ZERO,
                                                       BigInteger.ONE);
    public static final QMatrix Q        = new QMatrix(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE,
                                                       BigInteger.ZERO);

    public QMatrix {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        Objects.requireNonNull(c, "c cannot be null");
        Objects.requireNonNull(d, "d cannot be null");
    }

    /**
     * F(n) read from Q^n.
     */
    public static BigInteger fibonacci(long n) {
        Arguments.requireNatural(n, "n");
        return Q.pow(n).b();
    }

    /**
     * L(n) = F(n-1) + F(n+1), the trace of Q^n.
     */
    public static BigInteger lucas(long n) {
        Arguments.requireNatural(n, "n");
        return Q.pow(n).trace();
    }

    public QMatrix multiply(QMatrix o) {
        return new QMatrix(a.multiply(o.a).add(b.multiply(o.c)), a.multiply(o.b).add(b.multiply(o.d)),
                           c.multiply(o.a).add(d.multiply(o.c)), c.multiply(o.b).add(d.multiply(o.d)));
    }

    public QMatrix pow(long exponent) {
        Arguments.requireNatural(exponent, "exponent");
        var result = IDENTITY;
        var base = this;
        var e = exponent;
        while (e > 0) {
            if ((e & 1L) == 1L) {
                result = result.multiply(base);
            }
            e >>>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    public BigInteger determinant() {
        return a.multiply(d).subtract(b.multiply(c));
    }

    public BigInteger trace() {
        return a.add(d);
    }
}
