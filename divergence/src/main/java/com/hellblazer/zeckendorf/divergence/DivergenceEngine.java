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

/**
 * Computes the cumulative divergence profile over a closed range [0, N]. Implementations are stateless between calls:
 * the same N always yields an equal profile, and the profile of [0, M] equals the prefix of the profile of [0, N] for
 * any M &lt;= N.
 *
 * @author hal.hildebrand
 */
public interface DivergenceEngine {

    /**
     * @param bound the inclusive range bound N &gt;= 0
     * @throws com.hellblazer.zeckendorf.common.InvalidArgumentException if N is negative
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted mid-range
     */
    CumulativeProfile profile(int bound);

    /**
     * Profile of [0, tables.bound()] reusing lookup tables the caller already sized for the batch.
     */
    default CumulativeProfile profile(BatchTables tables) {
        return profile(tables.bound());
    }
}
