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
 * Zeckendorf decomposition: n as a sum of non-consecutive Fibonacci numbers F(i), i &gt;= 2. Unique by Zeckendorf's
 * theorem, and the greedy choice of the largest term not exceeding the residual is always part of it. After taking
 * F(i) the residual is below F(i-1), so the search continues from i - 2.
 * <p>
 * O(log n) terms, each found by binary search over the table.
 *
 * @author hal.hildebrand
 */
public class ZeckendorfDecomposer extends GreedyDecomposer {

    public ZeckendorfDecomposer() {
        this(null, true);
    }

    public ZeckendorfDecomposer(SequenceTable table) {
        this(table, true);
    }

    public ZeckendorfDecomposer(SequenceTable table, boolean verify) {
        super(SequenceKind.FIBONACCI, table, verify);
    }

    @Override
    protected List<Integer> select(BigInteger n, SequenceTable lookup) {
        var indices = new ArrayList<Integer>();
        var residual = n;
        int cap = lookup.lastIndex();
        while (residual.signum() > 0) {
            if (cap < 2) {
                throw new IllegalStateException("Greedy Zeckendorf selection exhausted for " + n + " at " + indices);
            }
            int index = lookup.floorIndex(residual, 2, cap);
            indices.add(index);
            residual = residual.subtract(lookup.value(index));
            cap = index - 2;
        }
        return indices;
    }
}
