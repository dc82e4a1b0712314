package io.github.jsonvalidation.json;

import io.github.jsonvalidation.json.internal.JsonNullImpl;

/// The interface that represents the JSON null literal.
public non-sealed interface JsonNull extends JsonValue {

    /// {@return the `JsonNull` instance}
    static JsonNull of() {
        return JsonNullImpl.NULL;
    }
}
