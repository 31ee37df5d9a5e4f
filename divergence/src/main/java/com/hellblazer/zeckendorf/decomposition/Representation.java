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

import com.hellblazer.zeckendorf.sequence.SequenceKind;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A decomposition of n into terms of one basis sequence. Indices are strictly decreasing and {@code values.get(i)} is
 * the basis value at {@code indices.get(i)}. A pure function of n: two representations of the same n and basis are
 * equal.
 *
 * @param n       the decomposed value
 * @param basis   the sequence the indices refer to
 * @param indices term indices, largest first
 * @param values  term values, aligned with {@code indices}
 *
 * @author hal.hildebrand
 */
public record Representation(BigInteger n, SequenceKind basis, List<Integer> indices, List<BigInteger> values) {

    public Representation {
        Objects.requireNonNull(n, "n cannot be null");
        Objects.requireNonNull(basis, "basis cannot be null");
        indices = List.copyOf(Objects.requireNonNull(indices, "indices cannot be null"));
        values = List.copyOf(Objects.requireNonNull(values, "values cannot be null"));
        if (indices.size() != values.size()) {
            throw new IllegalArgumentException(
            String.format("indices and values must align: %d vs %d", indices.size(), values.size()));
        }
    }

    /**
     * The representation of zero: no terms.
     */
    public static Representation empty(SequenceKind basis) {
        return new Representation(BigInteger.ZERO, basis, List.of(), List.of());
    }

    /**
     * Number of terms, z(n) for Zeckendorf and ℓ(n) for Lucas.
     */
    public int count() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    public BigInteger sum() {
        var total = BigInteger.ZERO;
        for (var value : values) {
            total = total.add(value);
        }
        return total;
    }

    public boolean contains(int index) {
        return indices.contains(index);
    }

    public int largestIndex() {
        if (indices.isEmpty()) {
            throw new IllegalStateException("Empty representation of " + n + " has no largest index");
        }
        return indices.get(0);
    }

    /**
     * Check the structural invariants: the terms sum to n, indices strictly decrease with no two adjacent, and for
     * Lucas the pair L(0), L(2) never appears together.
     *
     * @return descriptions of each broken invariant, empty when the representation is well formed
     */
    public List<String> invariantViolations() {
        var problems = new ArrayList<String>();
        var sum = sum();
        if (!sum.equals(n)) {
            problems.add("terms sum to " + sum + ", expected " + n);
        }
        for (int i = 1; i < indices.size(); i++) {
            int gap = indices.get(i - 1) - indices.get(i);
            if (gap <= 0) {
                problems.add("indices not strictly decreasing at position " + i + ": " + indices);
            } else if (gap == 1) {
                problems.add("adjacent indices " + indices.get(i - 1) + " and " + indices.get(i));
            }
        }
        if (basis == SequenceKind.LUCAS && indices.contains(0) && indices.contains(2)) {
            problems.add("L(0) and L(2) used together");
        }
        return problems;
    }

    public boolean isValid() {
        return invariantViolations().isEmpty();
    }

    /**
     * E.g. {@code 100 = F(11) + F(6) + F(4) = 89 + 8 + 3}.
     */
    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return n + " = 0";
        }
        var terms = indices.stream().map(basis::term).collect(Collectors.joining(" + "));
        var sums = values.stream().map(BigInteger::toString).collect(Collectors.joining(" + "));
        return n + " = " + terms + " = " + sums;
    }
}
