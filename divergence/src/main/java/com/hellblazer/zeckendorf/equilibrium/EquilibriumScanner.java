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
import com.hellblazer.zeckendorf.decomposition.LucasDecomposer;
import com.hellblazer.zeckendorf.divergence.BatchTables;
import com.hellblazer.zeckendorf.divergence.CumulativeProfile;
import com.hellblazer.zeckendorf.divergence.DivergenceConfig;
import com.hellblazer.zeckendorf.divergence.DivergenceEngine;
import com.hellblazer.zeckendorf.divergence.DivergenceEngines;
import com.hellblazer.zeckendorf.sequence.SequenceKind;
import com.hellblazer.zeckendorf.sequence.SequenceTable;
import com.hellblazer.zeckendorf.sequence.Sequences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Locates the zeros of S over [0, N] and classifies each against the Lucas boundaries, the indices n with n + 1 a
 * Lucas number.
 * <p>
 * Boundaries are found by walking the Lucas values in ascending order (1, 2, 3, 4, 7, 11, ...) alongside n, so the
 * scan does no membership test per index. A zero of S is cross-checked by decomposing n + 1: a single Lucas term
 * means a boundary. The two methods disagreeing is a defect, never a violation, and fails the scan.
 * <p>
 * Only the forward direction holds: every Lucas boundary is a zero of S, but S also vanishes at indices whose
 * successor is not a Lucas number (the first is n = 5). Those zeros are reported as violations rather than dropped,
 * so every zero in range is accounted for.
 *
 * @author hal.hildebrand
 */
public class EquilibriumScanner {

    private static final Logger log = LoggerFactory.getLogger(EquilibriumScanner.class);

    private final DivergenceEngine engine;
    private final boolean          verify;

    public EquilibriumScanner() {
        this(DivergenceConfig.defaultConfig());
    }

    public EquilibriumScanner(DivergenceConfig config) {
        this(DivergenceEngines.forConfig(config), config.isVerifyPostconditions());
    }

    public EquilibriumScanner(DivergenceEngine engine, boolean verify) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.verify = verify;
    }

    /**
     * Scan [0, bound].
     *
     * @throws com.hellblazer.zeckendorf.common.InvalidArgumentException if bound is negative or too large
     * @throws CancellationException                                     if the calling thread is interrupted
     */
    public EquilibriumScan scan(int bound) {
        Arguments.requireRange(bound, "N");
        var tables = BatchTables.forBound(bound);
        return scan(engine.profile(tables), tables);
    }

    /**
     * Alias of {@link #scan(int)}.
     */
    public EquilibriumScan findEquilibria(int bound) {
        return scan(bound);
    }

    /**
     * Classify the zeros of an already computed profile.
     */
    public EquilibriumScan scan(CumulativeProfile profile) {
        Objects.requireNonNull(profile, "profile cannot be null");
        return scan(profile, BatchTables.forBound(profile.bound()));
    }

    /**
     * Check a single index, computing the profile of [0, n].
     */
    public PointVerification verifyAt(int n) {
        Arguments.requireRange(n, "n");
        long s = engine.profile(n).s(n);
        int m = Sequences.lucasIndexOf(BigInteger.valueOf(n + 1L));
        boolean boundary = m >= 0;
        boolean zero = s == 0;
        String message;
        if (zero && boundary) {
            message = "S(" + n + ") = 0 and " + (n + 1L) + " = L(" + m + ")";
        } else if (!zero && !boundary) {
            message = "S(" + n + ") = " + s + " and " + (n + 1L) + " is not a Lucas number";
        } else if (zero) {
            message = Violation.zeroWithoutBoundary(n).reason();
        } else {
            message = Violation.boundaryWithoutZero(n, m, s).reason();
        }
        return new PointVerification(n, s, boundary, m, zero == boundary, message);
    }

    private EquilibriumScan scan(CumulativeProfile profile, BatchTables tables) {
        long start = System.nanoTime();
        int bound = profile.bound();
        var boundaries = boundaries(tables.lucas(), bound);
        var lucas = tables.lucasDecomposer(verify);

        var points = new ArrayList<EquilibriumPoint>();
        var violations = new ArrayList<Violation>();
        int zeros = 0;
        int next = 0;
        for (int n = 0; n <= bound; n++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Scan cancelled at index " + n);
            }
            boolean boundary = next < boundaries.size() && boundaries.get(next).n() == n;
            int m = boundary ? boundaries.get(next++).lucasIndex() : -1;
            long s = profile.s(n);
            if (s == 0) {
                zeros++;
                crossCheck(lucas, n, boundary);
                if (boundary) {
                    points.add(new EquilibriumPoint(n, m));
                } else {
                    violations.add(Violation.zeroWithoutBoundary(n));
                }
            } else if (boundary) {
                violations.add(Violation.boundaryWithoutZero(n, m, s));
            }
        }

        if (!violations.isEmpty()) {
            log.warn("{} of {} zeros of S in [0, {}] do not sit on a Lucas boundary", violations.size(), zeros,
                     bound);
            if (log.isDebugEnabled()) {
                violations.forEach(v -> log.debug("Violation: {}", v.reason()));
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Scanned [0, {}] in {} ms: {} equilibria, {} boundaries, {} zeros", bound,
                      (System.nanoTime() - start) / 1_000_000, points.size(), boundaries.size(), zeros);
        }
        return new EquilibriumScan(bound, points, violations, boundaries.size(), zeros);
    }

    private static void crossCheck(LucasDecomposer lucas, int n, boolean boundary) {
        boolean single = lucas.count(n + 1L) == 1;
        if (single != boundary) {
            throw new IllegalStateException(
            "Lucas boundary walk disagrees with decomposition at n=" + n + ": walk=" + boundary + ", terms of "
            + (n + 1L) + "=" + lucas.count(n + 1L));
        }
    }

    /**
     * The n in [0, bound] with n + 1 = L(m), ascending.
     */
    private static List<Boundary> boundaries(SequenceTable table, int bound) {
        if (table.kind() != SequenceKind.LUCAS) {
            throw new IllegalArgumentException("Not a Lucas table: " + table);
        }
        var limit = BigInteger.valueOf(bound + 1L);
        var result = new ArrayList<Boundary>();
        for (int m = 0; m < table.size(); m++) {
            var value = table.value(m);
            if (value.compareTo(limit) <= 0) {
                result.add(new Boundary(value.intValueExact() - 1, m));
            }
        }
        result.sort(Comparator.comparingInt(Boundary::n));
        return result;
    }

    private record Boundary(int n, int lucasIndex) {
    }
}
