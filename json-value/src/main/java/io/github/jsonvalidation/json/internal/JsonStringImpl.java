package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonString;

/// JsonString implementation class
public final class JsonStringImpl implements JsonString {

    private final String value;

    public JsonStringImpl(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return Utils.quote(value);
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof JsonString ojs && value.equals(ojs.value());
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
