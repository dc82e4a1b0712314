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

/// Provides APIs for parsing JSON text into an immutable tree of values and for
/// generating JSON text from such a tree.
///
/// ## Parsing JSON documents
/// Parsing produces a `JsonValue` from JSON text via `Json.parse(String)` or
/// `Json.parse(char[])`. A successful parse indicates that the JSON text adheres
/// to the RFC 8259 grammar. Text that does not, including text with trailing
/// content after the root value or objects with duplicate names, is rejected with
/// a `JsonParseException` that carries a machine-readable code and the line and
/// column of the offending character.
///
/// ## Retrieving JSON values
/// ```java
/// var name = doc.get("foo").get("bar").element(0).string();
/// ```
/// By chaining access methods, the "foo" member is retrieved from the root object,
/// then the "bar" member from "foo", followed by the element at index 0 from "bar".
///
/// ## Numbers
/// A `JsonNumber` keeps the literal text it was parsed from, so `1` and `1.0`
/// remain distinguishable and no precision is lost before a caller asks for a
/// `BigDecimal`, `long` or `double`.
///
/// ## Generating JSON documents
/// `JsonValue.toString()` produces the most compact representation, preserving
/// member order and number literals. `Json.toDisplayString(JsonValue, int)`
/// produces an indented representation suitable for logging or debugging.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///      Object Notation (JSON) Data Interchange Format
package io.github.jsonvalidation.json;
