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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * The single left-to-right fold. Each index costs one Zeckendorf and one Lucas decomposition, O(log k) each, for
 * O(N log N) in total. Working state between steps is the running (V, U) pair; the interrupt flag is checked between
 * steps so a long range can be abandoned.
 *
 * @author hal.hildebrand
 */
public class CumulativeDivergenceEngine implements DivergenceEngine {

    private static final Logger log = LoggerFactory.getLogger(CumulativeDivergenceEngine.class);

    private final boolean verify;

    public CumulativeDivergenceEngine() {
        this(DivergenceConfig.defaultConfig());
    }

    public CumulativeDivergenceEngine(DivergenceConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.verify = config.isVerifyPostconditions();
    }

    @Override
    public CumulativeProfile profile(int bound) {
        Arguments.requireRange(bound, "N");
        return profile(BatchTables.forBound(bound));
    }

    @Override
    public CumulativeProfile profile(BatchTables tables) {
        Objects.requireNonNull(tables, "tables cannot be null");
        long start = System.nanoTime();
        int bound = tables.bound();
        var zeckendorf = tables.zeckendorf(verify);
        var lucas = tables.lucasDecomposer(verify);

        int length = bound + 1;
        var z = new int[length];
        var l = new int[length];
        var v = new long[length];
        var u = new long[length];
        var s = new long[length];
        var d = new long[length];
        long runningV = 0;
        long runningU = 0;
        for (int k = 0; k < length; k++) {
            checkCancelled(k);
            z[k] = zeckendorf.count(k);
            l[k] = lucas.count(k);
            runningV += z[k];
            runningU += l[k];
            v[k] = runningV;
            u[k] = runningU;
            s[k] = runningV - runningU;
            d[k] = z[k] - l[k];
        }

        if (log.isDebugEnabled()) {
            log.debug("Sequential profile of [0, {}] in {} ms: V(N)={}, U(N)={}", bound,
                      (System.nanoTime() - start) / 1_000_000, runningV, runningU);
        }
        return new CumulativeProfile(z, l, v, u, s, d);
    }

    static void checkCancelled(int index) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Profile cancelled at index " + index);
        }
    }
}
