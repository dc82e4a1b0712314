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

import io.github.jsonvalidation.json.internal.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a JSON value.
///
/// Instances of `JsonValue` are immutable and thread safe.
///
/// A `JsonValue` can be produced by {@link Json#parse(String)}.
public sealed interface JsonValue
        permits JsonString, JsonNumber, JsonObject, JsonArray, JsonBoolean, JsonNull {

    /// {@return the String representation of this `JsonValue` that conforms
    /// to the JSON syntax} For a String representation suitable for display,
    /// use {@link Json#toDisplayString(JsonValue, int)}.
    String toString();

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw Utils.composeTypeError(this, "JsonBoolean");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw Utils.composeTypeError(this, "JsonString");
    }

    /// {@return the values of a `JsonArray`}
    default List<JsonValue> values() {
        throw Utils.composeTypeError(this, "JsonArray");
    }

    /// {@return the members of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw Utils.composeTypeError(this, "JsonObject");
    }

    /// {@return the `JsonValue` associated with the given member name of a `JsonObject`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject` or
    ///         there is no association with the member name
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        JsonValue member = members().get(name);
        if (member == null) {
            throw Utils.composeError(this,
                    String.format("JsonObject member \"%s\" does not exist.", name));
        }
        return member;
    }

    /// {@return an `Optional` containing the member with the given name, or empty
    /// if this `JsonObject` has no such member}
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the `JsonValue` at the given index of a `JsonArray`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonArray`
    ///         or the given index is outside the bounds
    default JsonValue element(int index) {
        List<JsonValue> values = values();
        if (index < 0 || index >= values.size()) {
            throw Utils.composeError(this, String.format(
                    "JsonArray index %d out of bounds for length %d.", index, values.size()));
        }
        return values.get(index);
    }
}
