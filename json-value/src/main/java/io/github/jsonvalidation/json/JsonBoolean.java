package io.github.jsonvalidation.json;

import io.github.jsonvalidation.json.internal.JsonBooleanImpl;

/// The interface that represents a JSON boolean.
public non-sealed interface JsonBoolean extends JsonValue {

    /// {@return the `boolean` value represented by this `JsonBoolean`}
    boolean value();

    @Override
    default boolean bool() {
        return value();
    }

    /// {@return the `JsonBoolean` for the given value}
    static JsonBoolean of(boolean value) {
        return value ? JsonBooleanImpl.TRUE : JsonBooleanImpl.FALSE;
    }
}
