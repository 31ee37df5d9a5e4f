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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Closed set of numeric kinds accepted at the library boundary. Each variant validates on construction and
 * {@link #asNatural()} narrows exactly: a value that is not a non-negative integer is rejected with
 * {@link InvalidArgumentException}, never rounded or truncated.
 *
 * @author hal.hildebrand
 */
public sealed interface Numeric permits Numeric.Natural, Numeric.Integral, Numeric.Real, Numeric.Complex {

    static Natural natural(long value) {
        return new Natural(BigInteger.valueOf(value));
    }

    static Natural natural(BigInteger value) {
        return new Natural(value);
    }

    static Integral integral(long value) {
        return new Integral(BigInteger.valueOf(value));
    }

    static Integral integral(BigInteger value) {
        return new Integral(value);
    }

    static Real real(double value) {
        return new Real(value);
    }

    static Complex complex(double real, double imaginary) {
        return new Complex(real, imaginary);
    }

    /**
     * Parse a decimal literal into the narrowest variant that represents it exactly: {@link Natural} for non-negative
     * integers, {@link Integral} for negative integers, {@link Real} otherwise. An integral literal written with a
     * fraction or exponent ({@code 7.0}, {@code 1e3}) is an integer. A fractional literal is rejected when its nearest
     * double would be an integer, since that value no longer says what the literal said.
     */
    static Numeric parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new InvalidArgumentException("literal", "cannot be empty");
        }
        BigDecimal exact;
        try {
            exact = new BigDecimal(literal.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("literal", "not a number: '" + literal + "'");
        }
        if (exact.signum() == 0 || exact.stripTrailingZeros().scale() <= 0) {
            var integer = exact.toBigIntegerExact();
            return integer.signum() < 0 ? new Integral(integer) : new Natural(integer);
        }
        double value = exact.doubleValue();
        if (value == Math.rint(value)) {
            throw new InvalidArgumentException("literal",
                                               "fractional value '" + literal.trim() + "' rounds to the integer "
                                               + value);
        }
        return new Real(value);
    }

    /**
     * Exact narrowing to a natural number.
     *
     * @throws InvalidArgumentException if this value is negative, fractional, non-finite or has an imaginary part
     */
    Natural asNatural();

    /**
     * ℕ: non-negative integers of arbitrary magnitude.
     */
    record Natural(BigInteger value) implements Numeric {

        public static final Natural ZERO = new Natural(BigInteger.ZERO);

        public Natural {
            Arguments.requireNatural(value, "value");
        }

        @Override
        public Natural asNatural() {
            return this;
        }

        /**
         * The value as an index that fits in an {@code int}.
         */
        public int intValueExact(String name) {
            if (value.bitLength() >= Integer.SIZE) {
                throw new InvalidArgumentException(name, "value " + value + " does not fit in an int index");
            }
            return value.intValue();
        }

        public long longValueExact(String name) {
            if (value.bitLength() >= Long.SIZE) {
                throw new InvalidArgumentException(name, "value " + value + " does not fit in a long index");
            }
            return value.longValue();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * ℤ: signed integers of arbitrary magnitude.
     */
    record Integral(BigInteger value) implements Numeric {

        public Integral {
            if (value == null) {
                throw new InvalidArgumentException("value", "cannot be null");
            }
        }

        @Override
        public Natural asNatural() {
            if (value.signum() < 0) {
                throw new InvalidArgumentException("value", "negative integer " + value + " is not a natural number");
            }
            return new Natural(value);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * ℝ: finite double precision values.
     */
    record Real(double value) implements Numeric {

        public Real {
            if (!Double.isFinite(value)) {
                throw new InvalidArgumentException("value", "must be finite, got " + value);
            }
        }

        public boolean isIntegral() {
            return value == Math.rint(value);
        }

        @Override
        public Natural asNatural() {
            if (!isIntegral()) {
                throw new InvalidArgumentException("value", "non-integer " + value + " is not a natural number");
            }
            if (value < 0) {
                throw new InvalidArgumentException("value", "negative value " + value + " is not a natural number");
            }
            return new Natural(new BigDecimal(value).toBigIntegerExact());
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * ℂ: a pair of finite real and imaginary parts.
     */
    record Complex(double real, double imaginary) implements Numeric {

        public Complex {
            if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
                throw new InvalidArgumentException("value",
                                                   "complex parts must be finite, got " + real + " + " + imaginary
                                                   + "i");
            }
        }

        public Complex conjugate() {
            return new Complex(real, -imaginary);
        }

        public double magnitude() {
            return Math.hypot(real, imaginary);
        }

        @Override
        public Natural asNatural() {
            if (imaginary != 0.0) {
                throw new InvalidArgumentException("value", "complex value " + this + " has an imaginary part");
            }
            return new Real(real).asNatural();
        }

        @Override
        public String toString() {
            return real + (imaginary < 0 ? " - " + (-imaginary) : " + " + imaginary) + "i";
        }
    }
}
