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

import java.util.List;

/**
 * Optional sink for scan observations. Implementations may fail; callers treat a failing store as lost
 * observations, never as a failed scan.
 *
 * @author hal.hildebrand
 */
public interface PatternStore {

    void storeEquilibrium(EquilibriumPoint point);

    /**
     * @param signature  name of an outcome class, e.g. "lucas-boundary"
     * @param exampleIds the indices n that fell into the class
     */
    void storePatternSignature(String signature, List<Integer> exampleIds);

    static PatternStore discarding() {
        return new PatternStore() {
            @Override
            public void storeEquilibrium(EquilibriumPoint point) {
            }

            @Override
            public void storePatternSignature(String signature, List<Integer> exampleIds) {
            }
        };
    }
}
