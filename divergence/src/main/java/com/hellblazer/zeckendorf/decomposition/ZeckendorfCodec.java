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
package com.hellblazer.zeckendorf.decomposition;

import com.hellblazer.zeckendorf.common.InvalidArgumentException;
import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fibonacci coding of Zeckendorf representations as bit strings. The rightmost bit stands for F(2), the next for
 * F(3) and so on; a valid code never contains two adjacent ones.
 * <pre>
 *   100 = F(11) + F(6) + F(4)  &lt;-&gt;  "1000010100"
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class ZeckendorfCodec {

    private ZeckendorfCodec() {
    }

    public static String encode(Representation representation) {
        Objects.requireNonNull(representation, "representation cannot be null");
        if (representation.basis() != SequenceKind.FIBONACCI) {
            throw new InvalidArgumentException("representation",
                                               "only Zeckendorf representations have a Fibonacci code, got "
                                               + representation.basis());
        }
        if (representation.isEmpty()) {
            return "0";
        }
        int highest = representation.largestIndex();
        var bits = new StringBuilder(highest - 1);
        for (int index = highest; index >= 2; index--) {
            bits.append(representation.contains(index) ? '1' : '0');
        }
        return bits.toString();
    }

    /**
     * The value a code stands for. Leading zeros are permitted.
     *
     * @throws InvalidArgumentException for an empty code, a character other than 0 or 1, or two adjacent ones
     */
    public static BigInteger decode(String bits) {
        validate(bits);
        var table = SequenceTable.ofLength(SequenceKind.FIBONACCI, bits.length() + 2);
        var value = BigInteger.ZERO;
        int length = bits.length();
        for (int i = 0; i < length; i++) {
            if (bits.charAt(i) == '1') {
                value = value.add(table.value(length - i + 1));
            }
        }
        return value;
    }

    public static Representation toRepresentation(String bits) {
        return new ZeckendorfDecomposer().decompose(decode(bits));
    }

    private static void validate(String bits) {
        if (bits == null || bits.isEmpty()) {
            throw new InvalidArgumentException("bits", "code cannot be empty");
        }
        char previous = '0';
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new InvalidArgumentException("bits", "invalid character '" + c + "' at position " + i);
            }
            if (c == '1' && previous == '1') {
                throw new InvalidArgumentException("bits", "adjacent ones at position " + i + " in " + bits);
            }
            previous = c;
        }
    }
}
