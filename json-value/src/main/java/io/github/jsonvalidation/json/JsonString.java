package io.github.jsonvalidation.json;

import io.github.jsonvalidation.json.internal.JsonStringImpl;

import java.util.Objects;

/// The interface that represents JSON string.
///
/// A `JsonString` can be produced by {@link Json#parse(String)} or
/// {@link #of(String)}.
public non-sealed interface JsonString extends JsonValue {

    /// {@return the unescaped `String` value of this `JsonString`}
    String value();

    @Override
    default String string() {
        return value();
    }

    /// {@return the `JsonString` holding the given value}
    ///
    /// @param value the string value. Non-null.
    static JsonString of(String value) {
        return new JsonStringImpl(Objects.requireNonNull(value));
    }

    /// {@return the JSON representation of this string, quoted and escaped}
    @Override
    String toString();
}
