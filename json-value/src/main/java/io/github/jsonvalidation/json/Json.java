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

import io.github.jsonvalidation.json.internal.JsonParser;
import io.github.jsonvalidation.json.internal.Utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// This class provides static methods for producing and manipulating a {@link JsonValue}.
///
/// {@link #parse(String)} and {@link #parse(char[])} produce a `JsonValue`
/// by parsing data adhering to the JSON syntax defined in RFC 8259.
///
/// {@link #toDisplayString(JsonValue, int)} is a formatter that produces a
/// representation of the JSON value suitable for display.
///
/// {@link #fromUntyped(Object)} and {@link #toUntyped(JsonValue)} provide a conversion
/// between `JsonValue` and an untyped object.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(json);
/// JsonValue fromJava = Json.fromUntyped(Map.of("active", true, "score", 95));
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    /// Parses and creates a `JsonValue` from the given JSON document.
    /// If parsing succeeds, it guarantees that the input document conforms to
    /// the JSON syntax. If the document contains any JSON Object that has
    /// duplicate names, a `JsonParseException` is thrown.
    ///
    /// `JsonObject`s preserve the order of their members declared in and parsed from
    /// the JSON document.
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @throws JsonParseException if the input JSON document does not conform
    ///         to the JSON document format or a JSON object containing
    ///         duplicate names is encountered.
    /// @throws NullPointerException if `in` is `null`
    /// @return the parsed `JsonValue`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in);
        return new JsonParser(in.toCharArray()).parseRoot();
    }

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// @param in the input JSON document as `char[]`. Non-null.
    /// @throws JsonParseException if the input does not conform to RFC 8259
    /// @throws NullPointerException if `in` is `null`
    /// @return the parsed `JsonValue`
    public static JsonValue parse(char[] in) {
        Objects.requireNonNull(in);
        // Copy so later changes to the caller's array cannot reach the parsed values
        return new JsonParser(Arrays.copyOf(in, in.length)).parseRoot();
    }

    /// {@return a `JsonValue` created from the given `src` object}
    /// The mapping from an untyped `src` object to a `JsonValue`
    /// follows the table below.
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Number*` | `JsonNumber` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `String` | `JsonString` |
    ///
    /// *The supported `Number` subclasses are: `Byte`,
    /// `Short`, `Integer`, `Long`, `Float`,
    /// `Double`, `BigInteger`, and `BigDecimal`.
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    ///         to a `JsonValue`.
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        }
        if (src instanceof JsonValue jv) {
            return jv;
        }
        if (src instanceof Map<?, ?> map) {
            Map<String, JsonValue> m = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            String.format("The key '%s' is not a String", entry.getKey()));
                }
                m.put(key, Json.fromUntyped(entry.getValue()));
            }
            return Utils.objectOf(m);
        }
        if (src instanceof List<?> list) {
            List<JsonValue> l = new ArrayList<>(list.size());
            for (Object o : list) {
                l.add(Json.fromUntyped(o));
            }
            return Utils.arrayOf(l);
        }
        if (src instanceof String str) {
            return JsonString.of(str);
        }
        if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        }
        if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        }
        if (src instanceof Float || src instanceof Double) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        if (src instanceof BigInteger bi) {
            return JsonNumber.of(bi);
        }
        if (src instanceof BigDecimal bd) {
            return JsonNumber.of(bd);
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `src` `JsonValue`}
    /// The mapping from a `JsonValue` to an untyped `src` object follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` (unmodifiable) |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonNumber` | `Number` |
    /// | `JsonObject` | `Map<String, Object>` (unmodifiable) |
    /// | `JsonString` | `String` |
    ///
    /// A `JsonObject` in `src` is converted to a `Map` whose
    /// entries occur in the same order as the `JsonObject`'s members.
    ///
    /// @param src the `JsonValue` to convert to untyped. Non-null.
    /// @throws NullPointerException if `src` is `null`
    /// @see #fromUntyped(Object)
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src instanceof JsonObject jo) {
            // LinkedHashMap rather than Collectors.toMap, which rejects null values
            Map<String, Object> m = new LinkedHashMap<>();
            jo.members().forEach((k, v) -> m.put(k, Json.toUntyped(v)));
            return Collections.unmodifiableMap(m);
        }
        if (src instanceof JsonArray ja) {
            List<Object> l = new ArrayList<>(ja.values().size());
            for (JsonValue v : ja.values()) {
                l.add(Json.toUntyped(v));
            }
            return Collections.unmodifiableList(l);
        }
        if (src instanceof JsonBoolean jb) {
            return jb.value();
        }
        if (src instanceof JsonNumber n) {
            return n.toNumber();
        }
        if (src instanceof JsonString js) {
            return js.value();
        }
        return null;
    }

    /// {@return the String representation of the given `JsonValue` that conforms
    /// to the JSON syntax} As opposed to the compact output returned by {@link
    /// JsonValue#toString()}, this method returns a JSON string that is better
    /// suited for display.
    ///
    /// @param value the `JsonValue` to create the display string from. Non-null.
    /// @param indent the number of spaces used for the indentation. Zero or positive.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `indent` is a negative number
    public static String toDisplayString(JsonValue value, int indent) {
        Objects.requireNonNull(value);
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        return toDisplayString(value, 0, indent, false);
    }

    private static String toDisplayString(JsonValue jv, int col, int indent, boolean isField) {
        if (jv instanceof JsonObject jo) {
            return toDisplayString(jo, col, indent, isField);
        }
        if (jv instanceof JsonArray ja) {
            return toDisplayString(ja, col, indent, isField);
        }
        return " ".repeat(isField ? 1 : col) + jv;
    }

    private static String toDisplayString(JsonObject jo, int col, int indent, boolean isField) {
        var prefix = " ".repeat(col);
        var s = new StringBuilder(isField ? " " : prefix);
        if (jo.members().isEmpty()) {
            s.append("{}");
        } else {
            s.append("{\n");
            jo.members().forEach((name, value) -> s.append(prefix)
                    .append(" ".repeat(indent))
                    .append(Utils.quote(name))
                    .append(":")
                    .append(Json.toDisplayString(value, col + indent, indent, true))
                    .append(",\n"));
            s.setLength(s.length() - 2); // trim final comma
            s.append("\n").append(prefix).append("}");
        }
        return s.toString();
    }

    private static String toDisplayString(JsonArray ja, int col, int indent, boolean isField) {
        var prefix = " ".repeat(col);
        var s = new StringBuilder(isField ? " " : prefix);
        if (ja.values().isEmpty()) {
            s.append("[]");
        } else {
            s.append("[\n");
            for (JsonValue v : ja.values()) {
                s.append(Json.toDisplayString(v, col + indent, indent, false)).append(",\n");
            }
            s.setLength(s.length() - 2); // trim final comma/newline
            s.append("\n").append(prefix).append("]");
        }
        return s.toString();
    }

    // no instantiation is allowed for this class
    private Json() {}
}
