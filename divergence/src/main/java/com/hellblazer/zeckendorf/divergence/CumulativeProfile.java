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

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * The series V, U, S and d over [0, N], together with the per-index counts z and ℓ they were folded from. Immutable:
 * accessors hand out copies, never the backing arrays.
 *
 * @author hal.hildebrand
 */
public final class CumulativeProfile {

    private final int[]  z;
    private final int[]  l;
    private final long[] v;
    private final long[] u;
    private final long[] s;
    private final long[] d;

    /**
     * Takes ownership of the arrays, which must all have length N + 1 and already be folded.
     */
    CumulativeProfile(int[] z, int[] l, long[] v, long[] u, long[] s, long[] d) {
        int length = z.length;
        if (length == 0 || l.length != length || v.length != length || u.length != length || s.length != length
        || d.length != length) {
            throw new IllegalArgumentException("Profile series must be non-empty and of equal length");
        }
        this.z = z;
        this.l = l;
        this.v = v;
        this.u = u;
        this.s = s;
        this.d = d;
    }

    /**
     * Fold per-index counts into the cumulative series: V(-1) = U(-1) = 0, V(k) = V(k-1) + z(k), U(k) = U(k-1) +
     * ℓ(k), S(k) = V(k) - U(k), d(k) = z(k) - ℓ(k).
     */
    public static CumulativeProfile fold(int[] zCounts, int[] lCounts) {
        Objects.requireNonNull(zCounts, "zCounts cannot be null");
        Objects.requireNonNull(lCounts, "lCounts cannot be null");
        if (zCounts.length != lCounts.length) {
            throw new IllegalArgumentException(
            "Count arrays must have equal length: " + zCounts.length + " vs " + lCounts.length);
        }
        int length = zCounts.length;
        var v = new long[length];
        var u = new long[length];
        var s = new long[length];
        var d = new long[length];
        long runningV = 0;
        long runningU = 0;
        for (int k = 0; k < length; k++) {
            runningV += zCounts[k];
            runningU += lCounts[k];
            v[k] = runningV;
            u[k] = runningU;
            s[k] = runningV - runningU;
            d[k] = zCounts[k] - lCounts[k];
        }
        return new CumulativeProfile(zCounts.clone(), lCounts.clone(), v, u, s, d);
    }

    /**
     * The range bound N.
     */
    public int bound() {
        return z.length - 1;
    }

    public int length() {
        return z.length;
    }

    public ProfilePoint point(int n) {
        Objects.checkIndex(n, z.length);
        return new ProfilePoint(n, z[n], l[n], v[n], u[n], s[n], d[n]);
    }

    public Stream<ProfilePoint> points() {
        return IntStream.range(0, z.length).mapToObj(this::point);
    }

    public int z(int n) {
        return z[n];
    }

    public int l(int n) {
        return l[n];
    }

    public long v(int n) {
        return v[n];
    }

    public long u(int n) {
        return u[n];
    }

    public long s(int n) {
        return s[n];
    }

    public long d(int n) {
        return d[n];
    }

    public int[] zCounts() {
        return z.clone();
    }

    public int[] lCounts() {
        return l.clone();
    }

    public long[] v() {
        return v.clone();
    }

    public long[] u() {
        return u.clone();
    }

    public long[] s() {
        return s.clone();
    }

    public long[] d() {
        return d.clone();
    }

    /**
     * The profile restricted to [0, bound].
     */
    public CumulativeProfile prefix(int bound) {
        Objects.checkIndex(bound, z.length);
        int length = bound + 1;
        return new CumulativeProfile(Arrays.copyOf(z, length), Arrays.copyOf(l, length), Arrays.copyOf(v, length),
                                     Arrays.copyOf(u, length), Arrays.copyOf(s, length), Arrays.copyOf(d, length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CumulativeProfile other)) {
            return false;
        }
        return Arrays.equals(z, other.z) && Arrays.equals(l, other.l) && Arrays.equals(v, other.v) && Arrays.equals(
        u, other.u) && Arrays.equals(s, other.s) && Arrays.equals(d, other.d);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(z), Arrays.hashCode(l), Arrays.hashCode(v), Arrays.hashCode(u));
    }

    @Override
    public String toString() {
        return "CumulativeProfile[N=" + bound() + ", V(N)=" + v[bound()] + ", U(N)=" + u[bound()] + ", S(N)="
        + s[bound()] + "]";
    }
}
