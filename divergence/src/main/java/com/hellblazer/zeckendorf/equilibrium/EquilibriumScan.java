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

import java.util.List;
import java.util.Objects;

/**
 * Outcome of scanning [0, bound] for zeros of S. Every zero of S in the range appears exactly once, either as an
 * equilibrium point or as a {@link Violation.Kind#ZERO_WITHOUT_LUCAS_BOUNDARY} violation. Both lists are in ascending
 * n.
 *
 * @param bound           the range bound N
 * @param points          zeros of S whose successor is a Lucas number
 * @param violations      mismatches between zeros and Lucas boundaries
 * @param lucasBoundaries number of n in range with n + 1 a Lucas number
 * @param zeroCrossings   number of n in range with S(n) = 0
 *
 * @author hal.hildebrand
 */
public record EquilibriumScan(int bound, List<EquilibriumPoint> points, List<Violation> violations,
                              int lucasBoundaries, int zeroCrossings) {

    public EquilibriumScan {
        points = List.copyOf(Objects.requireNonNull(points, "points cannot be null"));
        violations = List.copyOf(Objects.requireNonNull(violations, "violations cannot be null"));
    }

    /**
     * True when zeros of S and Lucas boundaries coincide exactly over the range.
     */
    public boolean theoremConsistent() {
        return violations.isEmpty();
    }

    /**
     * Fraction of zeros of S that land on a Lucas boundary; 1.0 for a range without zeros.
     */
    public double matchRate() {
        return zeroCrossings == 0 ? 1.0 : (double) points.size() / zeroCrossings;
    }

    public List<Violation> violationsOf(Violation.Kind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        return violations.stream().filter(v -> v.kind() == kind).toList();
    }

    public List<Integer> equilibriumIndices() {
        return points.stream().map(EquilibriumPoint::n).toList();
    }

    public List<Integer> violationIndices() {
        return violations.stream().map(Violation::n).toList();
    }
}
