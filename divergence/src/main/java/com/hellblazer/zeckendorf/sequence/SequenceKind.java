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

import java.math.BigInteger;

/**
 * The two bases this library decomposes against. Both share the recurrence value(n) = value(n-1) + value(n-2) and
 * differ only in their seeds.
 *
 * @author hal.hildebrand
 */
public enum SequenceKind {
    /** F(0) = 0, F(1) = 1 */
    FIBONACCI('F', BigInteger.ZERO, BigInteger.ONE),
    /** L(0) = 2, L(1) = 1 */
    LUCAS('L', BigInteger.TWO, BigInteger.ONE);

    private final char       symbol;
    private final BigInteger seed0;
    private final BigInteger seed1;

    SequenceKind(char symbol, BigInteger seed0, BigInteger seed1) {
        this.symbol = symbol;
        this.seed0 = seed0;
        this.seed1 = seed1;
    }

    /**
     * Single letter used when rendering a term, e.g. {@code F(11)}.
     */
    public char symbol() {
        return symbol;
    }

    public BigInteger seed0() {
        return seed0;
    }

    public BigInteger seed1() {
        return seed1;
    }

    public String term(int index) {
        return symbol + "(" + index + ")";
    }
}
