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
 * The running state of an incremental scan: the last index processed and V, U at that index.
 *
 * @param n last processed index, -1 before the first step
 * @param v V(n)
 * @param u U(n)
 *
 * @author hal.hildebrand
 */
public record WatchState(int n, long v, long u) {

    public static final WatchState INITIAL = new WatchState(-1, 0, 0);

    public long s() {
        return v - u;
    }
}
