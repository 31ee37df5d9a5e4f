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

/**
 * One index of a cumulative profile.
 *
 * @param n the index
 * @param z z(n), Zeckendorf term count
 * @param l ℓ(n), Lucas term count
 * @param v V(n) = z(0) + ... + z(n)
 * @param u U(n) = ℓ(0) + ... + ℓ(n)
 * @param s S(n) = V(n) - U(n)
 * @param d d(n) = z(n) - ℓ(n)
 *
 * @author hal.hildebrand
 */
public record ProfilePoint(int n, int z, int l, long v, long u, long s, long d) {

    public boolean isZero() {
        return s == 0;
    }

    @Override
    public String toString() {
        return String.format("n=%d: z=%d, ℓ=%d, V=%d, U=%d, S=%d, d=%d", n, z, l, v, u, s, d);
    }
}
