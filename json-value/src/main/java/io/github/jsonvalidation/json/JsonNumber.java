/*
 * Copyright (c) 2025, 2026, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.  Oracle designates this
 * particular file as subject to the "Classpath" exception as provided
 * by Oracle in the LICENSE file that accompanied this code.
 *
 * This code is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE.  See the GNU General Public License
 * version 2 for more details (a copy is included in the LICENSE file that
 * accompanied this code).
 *
 * You should have received a copy of the GNU General Public License version
 * 2 along with this work; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA.
 *
 * Please contact Oracle, 500 Oracle Parkway, Redwood Shores, CA 94065 USA
 * or visit www.oracle.com if you need additional information or have any
 * questions.
 */

package io.github.jsonvalidation.json;

import io.github.jsonvalidation.json.internal.JsonNumberImpl;

import java.math.BigDecimal;
import java.math.BigInteger;

/// The interface that represents JSON number, an arbitrary-precision
/// number represented in base 10 using decimal digits.
///
/// A `JsonNumber` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(double)}, {@link #of(long)}, or {@link #of(String)}
/// can be used to obtain a `JsonNumber`.
///
/// @apiNote
/// To avoid precision loss when converting JSON numbers to Java types, or when
/// converting JSON numbers outside the range of `long` or `double`, use
/// {@link #toBigDecimal()}.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259#section-6 RFC 8259:
///      The JavaScript Object Notation (JSON) Data Interchange Format - Numbers
public non-sealed interface JsonNumber extends JsonValue {

    /// {@return a `long` if it can be translated from the string
    /// representation of this `JsonNumber`} The value must be a whole number
    /// and within the range of {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE}.
    ///
    /// @throws JsonAssertionException if this `JsonNumber` cannot
    ///         be represented as a `long`.
    long toLong();

    /// {@return a finite `double` translated from the string representation
    /// of this `JsonNumber`}
    ///
    /// @throws JsonAssertionException if this `JsonNumber` cannot
    ///         be represented as a finite `double`.
    double toDouble();

    /// {@return the exact value of this `JsonNumber`}
    BigDecimal toBigDecimal();

    /// {@return a `Number` for this value} An integral literal becomes a `Long`,
    /// or a `BigInteger` when it does not fit. Any other literal becomes a
    /// `Double`, or a `BigDecimal` when it is not a finite double.
    Number toNumber();

    /// {@return `true` when the literal has neither a fraction nor an exponent part}
    /// `1` is an integral literal, `1.0` and `1e0` are not.
    boolean isIntegralLiteral();

    /// Creates a JSON number from the given `double` value.
    ///
    /// @throws IllegalArgumentException if the given `double` value
    ///         is not a finite floating-point value.
    static JsonNumber of(double num) {
        if (!Double.isFinite(num)) {
            throw new IllegalArgumentException("Not a valid JSON number");
        }
        return new JsonNumberImpl(Double.toString(num));
    }

    /// Creates a JSON number from the given `long` value.
    static JsonNumber of(long num) {
        return new JsonNumberImpl(Long.toString(num));
    }

    /// Creates a JSON number from the given `BigInteger` value.
    static JsonNumber of(BigInteger num) {
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from the given `BigDecimal` value.
    static JsonNumber of(BigDecimal num) {
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from the given `String` value.
    ///
    /// @throws IllegalArgumentException if `num` is not a valid string
    ///         representation of a JSON number.
    static JsonNumber of(String num) {
        try {
            if (Json.parse(num) instanceof JsonNumber jn) {
                return jn;
            }
        } catch (JsonParseException ex) {
            // reported below
        }
        throw new IllegalArgumentException("Not a JSON number: " + num);
    }

    /// {@return the string representation of this `JsonNumber`}
    ///
    /// If this `JsonNumber` is created by parsing a JSON number in a JSON document,
    /// it preserves the string representation in the document, regardless of its
    /// precision or range.
    @Override
    String toString();

    /// {@return true if the given `obj` is a `JsonNumber` with the same
    /// string representation, ignoring case} Use
    /// `toBigDecimal().compareTo(...)` for numeric equality.
    @Override
    boolean equals(Object obj);

    @Override
    int hashCode();
}
