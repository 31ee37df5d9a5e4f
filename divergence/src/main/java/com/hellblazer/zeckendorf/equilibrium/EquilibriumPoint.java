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
package com.hellblazer.zeckendorf.equilibrium;

import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import com.hellblazer.zeckendorf.sequence.SequenceKind;

import java.math.BigInteger;

/**
 * An index n with S(n) = 0 whose successor n + 1 is the Lucas number L(lucasIndex).
 *
 * @param n          the index in the scanned range
 * @param lucasIndex m such that L(m) = n + 1
 *
 * @author hal.hildebrand
 */
public record EquilibriumPoint(int n, int lucasIndex) {

    public EquilibriumPoint {
        if (n < 0) {
            throw new InvalidArgumentException("n", "must be non-negative, got " + n);
        }
        if (lucasIndex < 0) {
            throw new InvalidArgumentException("lucasIndex", "must be non-negative, got " + lucasIndex);
        }
    }

    /**
     * The Lucas boundary n + 1.
     */
    public BigInteger lucasValue() {
        return BigInteger.valueOf(n + 1L);
    }

    @Override
    public String toString() {
        return "n=" + n + " (" + (n + 1L) + " = " + SequenceKind.LUCAS.term(lucasIndex) + ")";
    }
}
