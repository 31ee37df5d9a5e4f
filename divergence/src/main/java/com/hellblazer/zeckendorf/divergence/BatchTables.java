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
package com.hellblazer.zeckendorf.divergence;

import com.hellblazer.zeckendorf.common.Arguments;
import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import com.hellblazer.zeckendorf.decomposition.LucasDecomposer;
import com.hellblazer.zeckendorf.decomposition.ZeckendorfDecomposer;
import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The Fibonacci and Lucas lookup tables for one batch over [0, N], sized once to cover N + 1 (the scanner looks one
 * past the range) and shared read-only by every step and shard of that batch.
 *
 * @param bound     the range bound N
 * @param fibonacci table covering N + 1
 * @param lucas     table covering N + 1
 *
 * @author hal.hildebrand
 */
public record BatchTables(int bound, SequenceTable fibonacci, SequenceTable lucas) {

    public BatchTables {
        Arguments.requireRange(bound, "bound");
        Objects.requireNonNull(fibonacci, "fibonacci cannot be null");
        Objects.requireNonNull(lucas, "lucas cannot be null");
        if (fibonacci.kind() != SequenceKind.FIBONACCI || lucas.kind() != SequenceKind.LUCAS) {
            throw new IllegalArgumentException("Tables are of the wrong kind: " + fibonacci + ", " + lucas);
        }
        var cover = BigInteger.valueOf(bound + 1L);
        if (!fibonacci.covers(cover)) {
            throw new InvalidArgumentException("fibonacci", fibonacci + " does not cover " + cover);
        }
        if (!lucas.covers(cover)) {
            throw new InvalidArgumentException("lucas", lucas + " does not cover " + cover);
        }
    }

    public static BatchTables forBound(int bound) {
        Arguments.requireRange(bound, "N");
        long cover = bound + 1L;
        return new BatchTables(bound, SequenceTable.covering(SequenceKind.FIBONACCI, cover),
                               SequenceTable.covering(SequenceKind.LUCAS, cover));
    }

    public ZeckendorfDecomposer zeckendorf(boolean verify) {
        return new ZeckendorfDecomposer(fibonacci, verify);
    }

    public LucasDecomposer lucasDecomposer(boolean verify) {
        return new LucasDecomposer(lucas, verify);
    }
}
