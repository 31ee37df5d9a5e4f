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

import java.util.Objects;

/**
 * Engine selection by range size.
 *
 * @author hal.hildebrand
 */
public final class DivergenceEngines {

    private DivergenceEngines() {
    }

    /**
     * An engine that sends each range to the sequential fold or the sharded engine according to the config.
     */
    public static DivergenceEngine forConfig(DivergenceConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return new AdaptiveEngine(config);
    }

    private static final class AdaptiveEngine implements DivergenceEngine {
        private final CumulativeDivergenceEngine sequential;
        private final ParallelDivergenceEngine   parallel;
        private final boolean                    enabled;
        private final int                        threshold;

        AdaptiveEngine(DivergenceConfig config) {
            this.sequential = new CumulativeDivergenceEngine(config);
            this.parallel = new ParallelDivergenceEngine(config);
            this.enabled = config.isEnableParallel() && config.getThreadCount() > 1;
            this.threshold = config.getParallelThreshold();
        }

        @Override
        public CumulativeProfile profile(int bound) {
            return select(bound).profile(bound);
        }

        @Override
        public CumulativeProfile profile(BatchTables tables) {
            Objects.requireNonNull(tables, "tables cannot be null");
            return select(tables.bound()).profile(tables);
        }

        private DivergenceEngine select(int bound) {
            return enabled && bound >= threshold ? parallel : sequential;
        }
    }
}
