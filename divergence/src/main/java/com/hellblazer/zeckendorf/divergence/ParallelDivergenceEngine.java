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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sharded computation of the cumulative profile.
 * <p>
 * Phase 1 (parallel): each shard [start, end) decomposes its indices and keeps shard-local running sums of z and ℓ.
 * Phase 2 (sequential): an exclusive prefix over the shard totals gives each shard its (V, U) offset.
 * Phase 3 (sequential): local sums plus offsets are written out and S, d derived. No S value exists until phase 3, so
 * nothing observes a partial sum as final.
 * <p>
 * Shards share the batch tables, which are immutable. Each call owns its own thread pool and shuts it down before
 * returning, so the engine itself holds no threads between calls.
 *
 * @author hal.hildebrand
 */
public class ParallelDivergenceEngine implements DivergenceEngine {

    private static final Logger log = LoggerFactory.getLogger(ParallelDivergenceEngine.class);

    private final int     shardSize;
    private final int     threadCount;
    private final boolean verify;

    public ParallelDivergenceEngine(DivergenceConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.shardSize = config.getShardSize();
        this.threadCount = config.getThreadCount();
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
        CumulativeDivergenceEngine.checkCancelled(0);
        long start = System.nanoTime();
        int bound = tables.bound();
        int length = bound + 1;

        var shards = new ArrayList<Callable<Shard>>();
        for (int from = 0; from < length; from += shardSize) {
            int to = (int) Math.min((long) from + shardSize, length);
            int shardFrom = from;
            shards.add(() -> computeShard(tables, shardFrom, to));
        }
        log.debug("Planned {} shards of up to {} indices for [0, {}] on {} threads", shards.size(), shardSize, bound,
                  threadCount);

        var results = execute(shards);

        var z = new int[length];
        var l = new int[length];
        var v = new long[length];
        var u = new long[length];
        var s = new long[length];
        var d = new long[length];
        long offsetV = 0;
        long offsetU = 0;
        for (var shard : results) {
            for (int i = 0; i < shard.size(); i++) {
                int k = shard.from + i;
                z[k] = shard.z[i];
                l[k] = shard.l[i];
                v[k] = offsetV + shard.localV[i];
                u[k] = offsetU + shard.localU[i];
                s[k] = v[k] - u[k];
                d[k] = z[k] - l[k];
            }
            offsetV += shard.totalV();
            offsetU += shard.totalU();
        }

        if (log.isDebugEnabled()) {
            log.debug("Parallel profile of [0, {}] in {} ms: V(N)={}, U(N)={}", bound,
                      (System.nanoTime() - start) / 1_000_000, offsetV, offsetU);
        }
        return new CumulativeProfile(z, l, v, u, s, d);
    }

    private List<Shard> execute(List<Callable<Shard>> shards) {
        var executor = newExecutor();
        try {
            var futures = executor.invokeAll(shards);
            var results = new ArrayList<Shard>(futures.size());
            for (Future<Shard> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Parallel profile interrupted");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Shard failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private Shard computeShard(BatchTables tables, int from, int to) {
        var zeckendorf = tables.zeckendorf(verify);
        var lucas = tables.lucasDecomposer(verify);
        int size = to - from;
        var shard = new Shard(from, size);
        long runningV = 0;
        long runningU = 0;
        for (int i = 0; i < size; i++) {
            int k = from + i;
            CumulativeDivergenceEngine.checkCancelled(k);
            shard.z[i] = zeckendorf.count(k);
            shard.l[i] = lucas.count(k);
            runningV += shard.z[i];
            runningU += shard.l[i];
            shard.localV[i] = runningV;
            shard.localU[i] = runningU;
        }
        return shard;
    }

    private ExecutorService newExecutor() {
        var counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            var thread = new Thread(runnable, "divergence-shard-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threadCount, factory);
    }

    /**
     * Counts and shard-local running sums for [from, from + size). Confined to the thread computing it until handed
     * back through its future.
     */
    private static final class Shard {
        final int    from;
        final int[]  z;
        final int[]  l;
        final long[] localV;
        final long[] localU;

        Shard(int from, int size) {
            this.from = from;
            this.z = new int[size];
            this.l = new int[size];
            this.localV = new long[size];
            this.localU = new long[size];
        }

        int size() {
            return z.length;
        }

        long totalV() {
            return localV.length == 0 ? 0 : localV[localV.length - 1];
        }

        long totalU() {
            return localU.length == 0 ? 0 : localU[localU.length - 1];
        }
    }
}
