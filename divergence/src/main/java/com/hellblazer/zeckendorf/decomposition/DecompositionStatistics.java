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

import com.hellblazer.zeckendorf.common.InvalidArgumentException;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary of the Zeckendorf and Lucas decompositions of a batch of inputs.
 *
 * @param total              number of inputs
 * @param minCount           smallest z(n)
 * @param maxCount           largest z(n)
 * @param averageCount       mean z(n)
 * @param averageLucasCount  mean ℓ(n)
 * @param allValid           every representation satisfied its invariants
 * @param countDistribution  z(n) to number of inputs with that term count
 * @param indexFrequency     Fibonacci index to number of representations using it
 *
 * @author hal.hildebrand
 */
public record DecompositionStatistics(int total, int minCount, int maxCount, double averageCount,
                                      double averageLucasCount, boolean allValid,
                                      SortedMap<Integer, Integer> countDistribution,
                                      SortedMap<Integer, Integer> indexFrequency) {

    public DecompositionStatistics {
        countDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(countDistribution));
        indexFrequency = Collections.unmodifiableSortedMap(new TreeMap<>(indexFrequency));
    }

    public static DecompositionStatistics analyze(Collection<BigInteger> inputs) {
        return analyze(inputs, new ZeckendorfDecomposer(), new LucasDecomposer());
    }

    public static DecompositionStatistics analyze(Collection<BigInteger> inputs, Decomposer zeckendorf,
                                                  Decomposer lucas) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(zeckendorf, "zeckendorf cannot be null");
        Objects.requireNonNull(lucas, "lucas cannot be null");
        if (inputs.isEmpty()) {
            throw new InvalidArgumentException("inputs", "cannot analyze an empty batch");
        }

        int min = Integer.MAX_VALUE;
        int max = 0;
        long totalCount = 0;
        long totalLucas = 0;
        boolean allValid = true;
        var distribution = new TreeMap<Integer, Integer>();
        var frequency = new TreeMap<Integer, Integer>();

        for (var n : inputs) {
            var z = zeckendorf.decompose(n);
            var l = lucas.decompose(n);
            min = Math.min(min, z.count());
            max = Math.max(max, z.count());
            totalCount += z.count();
            totalLucas += l.count();
            allValid &= z.isValid() && l.isValid();
            distribution.merge(z.count(), 1, Integer::sum);
            for (var index : z.indices()) {
                frequency.merge(index, 1, Integer::sum);
            }
        }

        int total = inputs.size();
        return new DecompositionStatistics(total, min, max, (double) totalCount / total, (double) totalLucas / total,
                                           allValid, distribution, frequency);
    }

    /**
     * The Fibonacci index used by the most representations, ties broken towards the smaller index.
     */
    public int mostCommonIndex() {
        Comparator<Map.Entry<Integer, Integer>> byUse = Map.Entry.comparingByValue();
        return indexFrequency.entrySet()
                             .stream()
                             .max(byUse.thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                             .map(Map.Entry::getKey)
                             .orElse(-1);
    }
}
