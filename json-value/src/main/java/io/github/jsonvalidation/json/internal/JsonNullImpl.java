package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonNull;

/// JsonNull implementation class
public final class JsonNullImpl implements JsonNull {

    public static final JsonNullImpl NULL = new JsonNullImpl();
    private static final String VALUE = "null";
    private static final int HASH = VALUE.hashCode();

    private JsonNullImpl() {}

    @Override
    public String toString() {
        return VALUE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNull;
    }

    @Override
    public int hashCode() {
        return HASH;
    }
}
