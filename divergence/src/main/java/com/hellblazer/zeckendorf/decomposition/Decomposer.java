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

import com.hellblazer.zeckendorf.common.Arguments;
import com.hellblazer.zeckendorf.sequence.SequenceKind;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decomposes natural numbers into terms of a basis sequence.
 *
 * @author hal.hildebrand
 */
public interface Decomposer {

    SequenceKind basis();

    /**
     * @throws com.hellblazer.zeckendorf.common.InvalidArgumentException if n is negative
     */
    Representation decompose(BigInteger n);

    default Representation decompose(long n) {
        return decompose(BigInteger.valueOf(Arguments.requireNatural(n, "n")));
    }

    /**
     * Term count of the representation of n.
     */
    default int count(long n) {
        return decompose(n).count();
    }

    default List<Representation> decomposeAll(Collection<BigInteger> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return inputs.stream().map(this::decompose).toList();
    }
}
