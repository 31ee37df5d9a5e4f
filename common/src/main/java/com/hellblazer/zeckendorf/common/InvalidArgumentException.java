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
package com.hellblazer.zeckendorf.common;

/**
 * Thrown at the API boundary when an argument is outside the domain of an operation: a negative index, a non-integer
 * value, or a range bound that cannot be addressed. Raised before any work begins, so a caught instance never leaves
 * partial results behind.
 *
 * @author hal.hildebrand
 */
public class InvalidArgumentException extends IllegalArgumentException {

    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super(argument + ": " + message);
        this.argument = argument;
    }

    /**
     * The name of the offending argument.
     */
    public String getArgument() {
        return argument;
    }
}
