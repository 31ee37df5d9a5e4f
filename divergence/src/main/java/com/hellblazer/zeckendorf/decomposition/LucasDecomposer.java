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

import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lucas decomposition over L(0) = 2, L(1) = 1, L(2) = 3, L(3) = 4, ...
 * <p>
 * Selection policy: repeatedly take the term of largest <em>value</em> not exceeding the residual among indices at
 * most two below the previous pick. Residuals of 3 and above pick from indices &gt;= 2 by binary search; a residual of
 * 2 takes L(0) and a residual of 1 takes L(1). No term is ever repeated.
 * <p>
 * The result is the canonical Lucas representation: indices pairwise non-adjacent and never L(0) together with
 * L(2) (3 + 2 is always written as L(3) + L(1)). Under those two rules the representation of every n is unique.
 * After taking L(2) the residual is zero, so the L(0)/L(2) rule never has to be enforced during selection; it is
 * still checked with the other invariants.
 *
 * @author hal.hildebrand
 */
public class LucasDecomposer extends GreedyDecomposer {

    private static final BigInteger THREE = BigInteger.valueOf(3);

    public LucasDecomposer() {
        this(null, true);
    }

    public LucasDecomposer(SequenceTable table) {
        this(table, true);
    }

    public LucasDecomposer(SequenceTable table, boolean verify) {
        super(SequenceKind.LUCAS, table, verify);
    }

    @Override
    protected List<Integer> select(BigInteger n, SequenceTable lookup) {
        var indices = new ArrayList<Integer>();
        var residual = n;
        int cap = lookup.lastIndex();
        while (residual.signum() > 0) {
            int index;
            if (residual.compareTo(THREE) >= 0) {
                index = cap >= 2 ? lookup.floorIndex(residual, 2, cap) : -1;
            } else {
                index = residual.equals(BigInteger.TWO) ? 0 : 1;
            }
            if (index < 0 || index > cap) {
                throw new IllegalStateException(
                String.format("Greedy Lucas selection exhausted for %s: residual %s, picked %s", n, residual,
                              indices));
            }
            indices.add(index);
            residual = residual.subtract(lookup.value(index));
            cap = index - 2;
        }
        return indices;
    }
}
