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
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable lookup table of one basis sequence, sized once and shared by reference for the duration of a batch. The
 * table is the only place values are memoized; nothing is cached globally.
 * <p>
 * From index 2 on both sequences are strictly increasing, which {@link #floorIndex} relies on. Indices 0 and 1 are
 * handled by callers since F(1) = F(2) and L(1) &lt; L(0).
 *
 * @author hal.hildebrand
 */
public final class SequenceTable {

    /** Smallest table: enough entries that index 2 onward is always present */
    private static final int MIN_LENGTH = 3;

    private final SequenceKind kind;
    private final BigInteger[] values;

    private SequenceTable(SequenceKind kind, BigInteger[] values) {
        this.kind = kind;
        this.values = values;
    }

    /**
     * A table holding value(0) .. value(count - 1).
     */
    public static SequenceTable ofLength(SequenceKind kind, int count) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Arguments.requirePositive(count, "count");
        var length = Math.max(count, MIN_LENGTH);
        return new SequenceTable(kind, Sequences.sequence(kind, length - 1));
    }

    /**
     * The smallest table whose last value strictly exceeds {@code max}, so every term not exceeding {@code max} is
     * present.
     */
    public static SequenceTable covering(SequenceKind kind, BigInteger max) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Arguments.requireNatural(max, "max");
        var buffer = new BigInteger[16];
        buffer[0] = kind.seed0();
        buffer[1] = kind.seed1();
        buffer[2] = buffer[0].add(buffer[1]);
        int size = MIN_LENGTH;
        while (buffer[size - 1].compareTo(max) <= 0) {
            if (size == buffer.length) {
                buffer = Arrays.copyOf(buffer, size * 2);
            }
            buffer[size] = buffer[size - 1].add(buffer[size - 2]);
            size++;
        }
        return new SequenceTable(kind, Arrays.copyOf(buffer, size));
    }

    public static SequenceTable covering(SequenceKind kind, long max) {
        return covering(kind, BigInteger.valueOf(max));
    }

    public SequenceKind kind() {
        return kind;
    }

    public int size() {
        return values.length;
    }

    public int lastIndex() {
        return values.length - 1;
    }

    public BigInteger value(int index) {
        Objects.checkIndex(index, values.length);
        return values[index];
    }

    public BigInteger last() {
        return values[values.length - 1];
    }

    /**
     * True if every term of the sequence not exceeding {@code v} is in this table.
     */
    public boolean covers(BigInteger v) {
        return last().compareTo(v) > 0;
    }

    /**
     * Largest index i in [from, to] with value(i) &lt;= v, or -1 if value(from) already exceeds v. Binary search over a
     * strictly increasing run, so {@code from} must be at least 2.
     */
    public int floorIndex(BigInteger v, int from, int to) {
        Objects.requireNonNull(v, "v cannot be null");
        if (from < 2 || to >= values.length || from > to) {
            throw new IllegalArgumentException("Invalid search range [" + from + ", " + to + "] for table of size "
                                               + values.length);
        }
        if (values[from].compareTo(v) > 0) {
            return -1;
        }
        int lo = from;
        int hi = to;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (values[mid].compareTo(v) <= 0) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /**
     * The index holding exactly {@code v}, or -1 if this table does not contain it. For Fibonacci the value 1 reports
     * index 2, the index Zeckendorf representations use.
     */
    public int indexOf(BigInteger v) {
        Objects.requireNonNull(v, "v cannot be null");
        if (v.equals(values[0])) {
            return 0;
        }
        if (v.equals(values[1]) && kind == SequenceKind.LUCAS) {
            return 1;
        }
        var floor = floorIndex(v, 2, lastIndex());
        return floor >= 0 && values[floor].equals(v) ? floor : -1;
    }

    public boolean isMember(BigInteger v) {
        return indexOf(v) >= 0;
    }

    @Override
    public String toString() {
        return "SequenceTable[" + kind + ", size=" + values.length + ", last=" + last() + "]";
    }
}
