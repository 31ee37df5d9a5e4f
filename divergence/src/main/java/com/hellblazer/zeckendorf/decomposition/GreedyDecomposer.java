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
import com.hellblazer.zeckendorf.sequence.SequenceTable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Common frame for the greedy decomposers: resolves the lookup table, runs the subclass's term selection, and checks
 * the result's invariants before handing it out.
 * <p>
 * A decomposer built with a table uses it for every n the table covers and builds a private, call-local table for
 * anything larger. Either way the decomposer holds no mutable state and is safe to share across threads.
 *
 * @author hal.hildebrand
 */
public abstract class GreedyDecomposer implements Decomposer {

    private final SequenceKind  basis;
    private final SequenceTable table;
    private final boolean       verify;

    protected GreedyDecomposer(SequenceKind basis, SequenceTable table, boolean verify) {
        this.basis = Objects.requireNonNull(basis, "basis cannot be null");
        if (table != null && table.kind() != basis) {
            throw new IllegalArgumentException("Table of " + table.kind() + " cannot back a " + basis + " decomposer");
        }
        this.table = table;
        this.verify = verify;
    }

    @Override
    public SequenceKind basis() {
        return basis;
    }

    @Override
    public Representation decompose(BigInteger n) {
        Arguments.requireNatural(n, "n");
        if (n.signum() == 0) {
            return Representation.empty(basis);
        }
        var lookup = tableFor(n);
        var indices = select(n, lookup);
        var values = new ArrayList<BigInteger>(indices.size());
        for (var index : indices) {
            values.add(lookup.value(index));
        }
        var representation = new Representation(n, basis, indices, values);
        if (verify) {
            var problems = representation.invariantViolations();
            if (!problems.isEmpty()) {
                throw new IllegalStateException(
                String.format("Invalid %s decomposition of %s %s: %s", basis, n, indices, problems));
            }
        }
        return representation;
    }

    public boolean isVerifying() {
        return verify;
    }

    /**
     * The shared table when it covers n, otherwise a table sized for this call alone.
     */
    protected SequenceTable tableFor(BigInteger n) {
        if (table != null && table.covers(n)) {
            return table;
        }
        return SequenceTable.covering(basis, n);
    }

    /**
     * Term indices for n &gt; 0, largest first.
     *
     * @param n      the positive value to decompose
     * @param lookup a table covering n
     */
    protected abstract List<Integer> select(BigInteger n, SequenceTable lookup);
}
