/*
 * Copyright (c) 2025, Oracle and/or its affiliates. All rights reserved.
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

import io.github.jsonvalidation.json.internal.JsonArrayImpl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The interface that represents JSON array.
///
/// A `JsonArray` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(List)} can be used to obtain a `JsonArray`.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = JsonArray.of(List.of(
///     JsonString.of("first"),
///     JsonNumber.of(42),
///     JsonBoolean.of(true)
/// ));
/// for (JsonValue value : arr.values()) {
///     if (value instanceof JsonString s) {
///         System.out.println("String: " + s.value());
///     }
/// }
/// ```
public non-sealed interface JsonArray extends JsonValue {

    /// {@return an unmodifiable list of the `JsonValue` elements in
    /// this `JsonArray`}
    @Override
    List<JsonValue> values();

    /// {@return the `JsonArray` created from the given
    /// list of `JsonValue`s}
    ///
    /// @param src the list of `JsonValue`s. Non-null.
    /// @throws NullPointerException if `src` is `null`, or contains
    ///         any values that are `null`
    static JsonArray of(List<? extends JsonValue> src) {
        // List::contains throws NPE on immutable lists, so check element by element
        List<JsonValue> copy = new ArrayList<>(src.size());
        for (JsonValue v : src) {
            copy.add(Objects.requireNonNull(v));
        }
        return new JsonArrayImpl(copy);
    }

    /// {@return `true` if the given object is also a `JsonArray`
    /// and the two `JsonArray`s represent the same elements}
    @Override
    boolean equals(Object obj);

    /// {@return the hash code value for this `JsonArray`}
    @Override
    int hashCode();
}
