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

import com.hellblazer.zeckendorf.common.Arguments;
import com.hellblazer.zeckendorf.decomposition.Decomposer;
import com.hellblazer.zeckendorf.decomposition.LucasDecomposer;
import com.hellblazer.zeckendorf.decomposition.ZeckendorfDecomposer;
import com.hellblazer.zeckendorf.sequence.Sequences;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Advances the fold one index at a time for callers that watch an open-ended range. The watcher is stateless; the
 * caller threads {@link WatchState} through successive calls, starting from {@link #start()}.
 *
 * @author hal.hildebrand
 */
public class EquilibriumWatcher {

    private final Decomposer zeckendorf;
    private final Decomposer lucas;

    public EquilibriumWatcher() {
        this(new ZeckendorfDecomposer(), new LucasDecomposer());
    }

    EquilibriumWatcher(Decomposer zeckendorf, Decomposer lucas) {
        this.zeckendorf = Objects.requireNonNull(zeckendorf, "zeckendorf cannot be null");
        this.lucas = Objects.requireNonNull(lucas, "lucas cannot be null");
    }

    public WatchState start() {
        return WatchState.INITIAL;
    }

    /**
     * Process index state.n() + 1.
     *
     * @throws IllegalStateException if the index would leave the supported range
     */
    public WatchStep advance(WatchState state) {
        Objects.requireNonNull(state, "state cannot be null");
        if (state.n() >= Arguments.MAX_RANGE) {
            throw new IllegalStateException("Cannot advance past n=" + state.n());
        }
        int n = state.n() + 1;
        int z = zeckendorf.count(n);
        int l = lucas.count(n);
        var next = new WatchState(n, state.v() + z, state.u() + l);
        return new WatchStep(next, z, l, Sequences.lucasIndexOf(BigInteger.valueOf(n + 1L)));
    }
}
