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

/**
 * Configuration for cumulative divergence computation. Controls when the sharded parallel engine takes over from the
 * sequential fold and how it splits the range. Engines copy the values they need when constructed, so later changes
 * to a config do not affect an engine already built from it.
 *
 * @author hal.hildebrand
 */
public class DivergenceConfig {

    public static final int DEFAULT_PARALLEL_THRESHOLD = 50_000;
    public static final int DEFAULT_SHARD_SIZE         = 8_192;

    private boolean enableParallel       = true;
    private int     parallelThreshold    = DEFAULT_PARALLEL_THRESHOLD;
    private int     shardSize            = DEFAULT_SHARD_SIZE;
    private int     threadCount          = Runtime.getRuntime().availableProcessors();
    private boolean verifyPostconditions = true;

    /**
     * Defaults: parallel above {@value #DEFAULT_PARALLEL_THRESHOLD} indices, every decomposition verified.
     */
    public static DivergenceConfig defaultConfig() {
        return new DivergenceConfig();
    }

    /**
     * Always the single-threaded fold.
     */
    public static DivergenceConfig sequential() {
        return new DivergenceConfig().withParallelProcessing(false);
    }

    /**
     * Large shards, early hand-off to the parallel engine, post-condition checks skipped.
     */
    public static DivergenceConfig highThroughput() {
        return new DivergenceConfig().withParallelProcessing(true)
                                     .withParallelThreshold(10_000)
                                     .withShardSize(32_768)
                                     .withPostconditionChecks(false);
    }

    /**
     * Whether ranges at or above the parallel threshold are split into shards.
     */
    public boolean isEnableParallel() {
        return enableParallel;
    }

    /**
     * Smallest range bound N handled by the parallel engine.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Number of consecutive indices per shard.
     */
    public int getShardSize() {
        return shardSize;
    }

    public int getThreadCount() {
        return threadCount;
    }

    /**
     * Whether each decomposition re-checks its sum and adjacency invariants.
     */
    public boolean isVerifyPostconditions() {
        return verifyPostconditions;
    }

    public DivergenceConfig withParallelProcessing(boolean parallel) {
        this.enableParallel = parallel;
        return this;
    }

    public DivergenceConfig withParallelThreshold(int threshold) {
        this.parallelThreshold = Arguments.requirePositive(threshold, "parallelThreshold");
        return this;
    }

    public DivergenceConfig withShardSize(int size) {
        this.shardSize = Arguments.requirePositive(size, "shardSize");
        return this;
    }

    public DivergenceConfig withThreadCount(int threads) {
        this.threadCount = Arguments.requirePositive(threads, "threadCount");
        return this;
    }

    public DivergenceConfig withPostconditionChecks(boolean verify) {
        this.verifyPostconditions = verify;
        return this;
    }

    @Override
    public String toString() {
        return String.format("DivergenceConfig[parallel=%s, threshold=%d, shardSize=%d, threads=%d, verify=%s]",
                             enableParallel, parallelThreshold, shardSize, threadCount, verifyPostconditions);
    }
}
