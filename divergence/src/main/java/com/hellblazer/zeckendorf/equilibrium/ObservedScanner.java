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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Runs scans and reports their outcome to a {@link PatternStore}. Store failures are logged and dropped; the scan
 * result returned is the same with or without a store.
 *
 * @author hal.hildebrand
 */
public class ObservedScanner {

    public static final String LUCAS_BOUNDARY_SIGNATURE = "lucas-boundary";

    private static final Logger log = LoggerFactory.getLogger(ObservedScanner.class);

    private final EquilibriumScanner scanner;
    private final PatternStore       store;

    public ObservedScanner(EquilibriumScanner scanner, PatternStore store) {
        this.scanner = Objects.requireNonNull(scanner, "scanner cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
    }

    public static String signatureOf(Violation.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public EquilibriumScan scan(int bound) {
        var result = scanner.scan(bound);
        record(result);
        return result;
    }

    private void record(EquilibriumScan result) {
        for (var point : result.points()) {
            attempt("equilibrium " + point, () -> store.storeEquilibrium(point));
        }
        if (!result.points().isEmpty()) {
            attempt("signature " + LUCAS_BOUNDARY_SIGNATURE,
                    () -> store.storePatternSignature(LUCAS_BOUNDARY_SIGNATURE, result.equilibriumIndices()));
        }
        for (var kind : Violation.Kind.values()) {
            var ids = result.violationsOf(kind).stream().map(Violation::n).toList();
            if (!ids.isEmpty()) {
                var signature = signatureOf(kind);
                attempt("signature " + signature, () -> store.storePatternSignature(signature, ids));
            }
        }
    }

    /**
     * One store call; a failure loses that observation only.
     */
    private void attempt(String observation, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Pattern store rejected {}: {}", observation, e.getMessage(), e);
        }
    }
}
