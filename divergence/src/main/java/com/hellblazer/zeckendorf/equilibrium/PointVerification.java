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

/**
 * Check of a single index: whether S(n) = 0 and n + 1 is a Lucas number agree.
 *
 * @param n             the index
 * @param s             S(n)
 * @param lucasBoundary whether n + 1 is a Lucas number
 * @param lucasIndex    m with L(m) = n + 1, or -1
 * @param verified      true when both sides agree
 * @param message       description of the outcome
 *
 * @author hal.hildebrand
 */
public record PointVerification(int n, long s, boolean lucasBoundary, int lucasIndex, boolean verified,
                                String message) {

    public boolean isEquilibrium() {
        return s == 0 && lucasBoundary;
    }
}
