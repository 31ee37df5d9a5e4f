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

/**
 * An index where the zero set of S and the Lucas boundaries disagree.
 *
 * @param n      the index
 * @param kind   which direction of the correspondence failed
 * @param s      S(n) at the index
 * @param reason human-readable account of the mismatch
 *
 * @author hal.hildebrand
 */
public record Violation(int n, Kind kind, long s, String reason) {

    public enum Kind {
        /** S(n) = 0 while n + 1 is not a Lucas number. */
        ZERO_WITHOUT_LUCAS_BOUNDARY,
        /** n + 1 is a Lucas number while S(n) is not zero. */
        LUCAS_BOUNDARY_WITHOUT_ZERO
    }

    public Violation {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
    }

    static Violation zeroWithoutBoundary(int n) {
        return new Violation(n, Kind.ZERO_WITHOUT_LUCAS_BOUNDARY, 0,
                             "S(" + n + ") = 0 but " + (n + 1L) + " is not a Lucas number");
    }

    static Violation boundaryWithoutZero(int n, int lucasIndex, long s) {
        return new Violation(n, Kind.LUCAS_BOUNDARY_WITHOUT_ZERO, s,
                             (n + 1L) + " = L(" + lucasIndex + ") but S(" + n + ") = " + s);
    }
}
