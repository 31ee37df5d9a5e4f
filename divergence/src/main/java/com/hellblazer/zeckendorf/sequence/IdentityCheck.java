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
package com.hellblazer.zeckendorf.sequence;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Outcome of evaluating one classical identity at one index: both sides, exactly.
 *
 * @param identity name of the identity, e.g. "cassini"
 * @param n        the index evaluated
 * @param left     value of the left-hand side
 * @param right    value of the right-hand side
 *
 * @author hal.hildebrand
 */
public record IdentityCheck(String identity, long n, BigInteger left, BigInteger right) {

    public IdentityCheck {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
    }

    public boolean holds() {
        return left.equals(right);
    }

    @Override
    public String toString() {
        return String.format("%s(%d): %s %s %s", identity, n, left, holds() ? "==" : "!=", right);
    }
}
