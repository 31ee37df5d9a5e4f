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

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fail-fast argument checks shared by the public entry points.
 *
 * @author hal.hildebrand
 */
public final class Arguments {

    /** Largest range bound N for which an array of N + 1 entries can be allocated */
    public static final int MAX_RANGE = Integer.MAX_VALUE - 8;

    private Arguments() {
    }

    public static long requireNatural(long value, String name) {
        if (value < 0) {
            throw new InvalidArgumentException(name, "must be a natural number (>= 0), got " + value);
        }
        return value;
    }

    public static BigInteger requireNatural(BigInteger value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.signum() < 0) {
            throw new InvalidArgumentException(name, "must be a natural number (>= 0), got " + value);
        }
        return value;
    }

    /**
     * Validate an inclusive range bound [0, N] that will back arrays of length N + 1.
     */
    public static int requireRange(long bound, String name) {
        requireNatural(bound, name);
        if (bound > MAX_RANGE) {
            throw new InvalidArgumentException(name, "range bound " + bound + " exceeds maximum " + MAX_RANGE);
        }
        return (int) bound;
    }

    public static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new InvalidArgumentException(name, "must be positive, got " + value);
        }
        return value;
    }
}
