package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonBoolean;

/// JsonBoolean implementation class
public final class JsonBooleanImpl implements JsonBoolean {

    public static final JsonBooleanImpl TRUE = new JsonBooleanImpl(true);
    public static final JsonBooleanImpl FALSE = new JsonBooleanImpl(false);

    private final boolean value;

    private JsonBooleanImpl(boolean value) {
        this.value = value;
    }

    @Override
    public boolean value() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof JsonBoolean ojb && value == ojb.value();
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
