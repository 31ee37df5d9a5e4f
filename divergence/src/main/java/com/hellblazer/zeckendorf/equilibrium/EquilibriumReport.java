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

import com.hellblazer.zeckendorf.divergence.CumulativeProfile;

import java.util.Locale;
import java.util.Objects;

/**
 * Plain-text rendering of a scan.
 *
 * @author hal.hildebrand
 */
public final class EquilibriumReport {

    private static final String RULE = "=".repeat(60);

    private EquilibriumReport() {
    }

    /**
     * @param scan    the scan to render
     * @param profile the profile the scan was taken over, used for the per-point V, U, z, ℓ, d columns
     */
    public static String format(EquilibriumScan scan, CumulativeProfile profile) {
        Objects.requireNonNull(scan, "scan cannot be null");
        Objects.requireNonNull(profile, "profile cannot be null");
        if (profile.bound() < scan.bound()) {
            throw new IllegalArgumentException(
            "Profile covers [0, " + profile.bound() + "] but scan covers [0, " + scan.bound() + "]");
        }
        var out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("Equilibrium scan of [0, ").append(scan.bound()).append("]\n");
        out.append(RULE).append('\n');
        out.append("Status: ")
           .append(scan.theoremConsistent() ? "zeros and Lucas boundaries coincide"
                                            : scan.violations().size() + " violation(s)")
           .append("\n\n");

        out.append("Equilibria (").append(scan.points().size()).append("):\n");
        for (var point : scan.points()) {
            int n = point.n();
            out.append(String.format(Locale.ROOT, "  n=%-8d L(%d)=%-8d V=%-8d U=%-8d z=%d l=%d d=%d%n", n,
                                     point.lucasIndex(), n + 1L, profile.v(n), profile.u(n), profile.z(n),
                                     profile.l(n), profile.d(n)));
        }

        if (!scan.violations().isEmpty()) {
            out.append("\nViolations (").append(scan.violations().size()).append("):\n");
            for (var violation : scan.violations()) {
                out.append("  ").append(violation.kind()).append(": ").append(violation.reason()).append('\n');
            }
        }

        out.append("\nStatistics:\n");
        out.append("  Indices scanned:  ").append(scan.bound() + 1L).append('\n');
        out.append("  Zeros of S:       ").append(scan.zeroCrossings()).append('\n');
        out.append("  Lucas boundaries: ").append(scan.lucasBoundaries()).append('\n');
        out.append("  Equilibria:       ").append(scan.points().size()).append('\n');
        out.append(String.format(Locale.ROOT, "  Match rate:       %.2f%%%n", scan.matchRate() * 100.0));
        return out.toString();
    }
}
