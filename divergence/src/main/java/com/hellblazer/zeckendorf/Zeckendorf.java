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
package com.hellblazer.zeckendorf;

import com.hellblazer.zeckendorf.common.Arguments;
import com.hellblazer.zeckendorf.common.Numeric;
import com.hellblazer.zeckendorf.decomposition.LucasDecomposer;
import com.hellblazer.zeckendorf.decomposition.Representation;
import com.hellblazer.zeckendorf.decomposition.ZeckendorfDecomposer;
import com.hellblazer.zeckendorf.divergence.CumulativeProfile;
import com.hellblazer.zeckendorf.divergence.DivergenceConfig;
import com.hellblazer.zeckendorf.divergence.DivergenceEngines;
import com.hellblazer.zeckendorf.equilibrium.EquilibriumScan;
import com.hellblazer.zeckendorf.equilibrium.EquilibriumScanner;
import com.hellblazer.zeckendorf.sequence.Sequences;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Entry points for one-off computations with the default configuration. Inputs arriving as {@link Numeric} are
 * narrowed to naturals first; anything else (negative, fractional, complex) fails with
 * {@link com.hellblazer.zeckendorf.common.InvalidArgumentException}.
 *
 * @author hal.hildebrand
 */
public final class Zeckendorf {

    private static final ZeckendorfDecomposer ZECKENDORF = new ZeckendorfDecomposer();
    private static final LucasDecomposer      LUCAS      = new LucasDecomposer();

    private Zeckendorf() {
    }

    public static BigInteger fibonacci(long n) {
        return Sequences.fibonacci(n);
    }

    public static BigInteger fibonacci(Numeric n) {
        return fibonacci(index(n));
    }

    public static BigInteger lucas(long n) {
        return Sequences.lucas(n);
    }

    public static BigInteger lucas(Numeric n) {
        return lucas(index(n));
    }

    public static Representation decomposeZeckendorf(long n) {
        return ZECKENDORF.decompose(n);
    }

    public static Representation decomposeZeckendorf(BigInteger n) {
        return ZECKENDORF.decompose(n);
    }

    public static Representation decomposeZeckendorf(Numeric n) {
        return ZECKENDORF.decompose(natural(n));
    }

    public static Representation decomposeLucas(long n) {
        return LUCAS.decompose(n);
    }

    public static Representation decomposeLucas(BigInteger n) {
        return LUCAS.decompose(n);
    }

    public static Representation decomposeLucas(Numeric n) {
        return LUCAS.decompose(natural(n));
    }

    public static CumulativeProfile cumulativeProfile(int bound) {
        return DivergenceEngines.forConfig(DivergenceConfig.defaultConfig()).profile(bound);
    }

    public static CumulativeProfile cumulativeProfile(Numeric bound) {
        return cumulativeProfile(range(bound));
    }

    public static EquilibriumScan findEquilibria(int bound) {
        return new EquilibriumScanner().scan(bound);
    }

    public static EquilibriumScan findEquilibria(Numeric bound) {
        return findEquilibria(range(bound));
    }

    private static BigInteger natural(Numeric n) {
        Objects.requireNonNull(n, "n cannot be null");
        return n.asNatural().value();
    }

    private static long index(Numeric n) {
        Objects.requireNonNull(n, "n cannot be null");
        return n.asNatural().longValueExact("n");
    }

    private static int range(Numeric bound) {
        Objects.requireNonNull(bound, "N cannot be null");
        return Arguments.requireRange(bound.asNatural().longValueExact("N"), "N");
    }
}
