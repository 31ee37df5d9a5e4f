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

import java.util.Objects;
import java.util.Optional;

/**
 * One step of an incremental scan.
 *
 * @param state      state after the step
 * @param z          z(n)
 * @param l          ℓ(n)
 * @param lucasIndex m with L(m) = n + 1, or -1
 *
 * @author hal.hildebrand
 */
public record WatchStep(WatchState state, int z, int l, int lucasIndex) {

    public WatchStep {
        Objects.requireNonNull(state, "state cannot be null");
    }

    public int n() {
        return state.n();
    }

    public long s() {
        return state.s();
    }

    public long d() {
        return (long) z - l;
    }

    public boolean lucasBoundary() {
        return lucasIndex >= 0;
    }

    public boolean isEquilibrium() {
        return s() == 0 && lucasBoundary();
    }

    public Optional<EquilibriumPoint> equilibrium() {
        return isEquilibrium() ? Optional.of(new EquilibriumPoint(n(), lucasIndex)) : Optional.empty();
    }

    public Optional<Violation> violation() {
        boolean zero = s() == 0;
        if (zero && !lucasBoundary()) {
            return Optional.of(Violation.zeroWithoutBoundary(n()));
        }
        if (!zero && lucasBoundary()) {
            return Optional.of(Violation.boundaryWithoutZero(n(), lucasIndex, s()));
        }
        return Optional.empty();
    }
}
