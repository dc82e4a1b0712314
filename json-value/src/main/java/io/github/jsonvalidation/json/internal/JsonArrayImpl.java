package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonValue;

import java.util.Collections;
import java.util.List;

/// JsonArray implementation class
public final class JsonArrayImpl implements JsonArray {

    private final List<JsonValue> values;

    public JsonArrayImpl(List<JsonValue> values) {
        this.values = Collections.unmodifiableList(values);
    }

    @Override
    public List<JsonValue> values() {
        return values;
    }

    @Override
    public String toString() {
        var s = new StringBuilder("[");
        for (JsonValue v : values) {
            s.append(v).append(',');
        }
        if (!values.isEmpty()) {
            s.setLength(s.length() - 1); // trim final comma
        }
        return s.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof JsonArray oja && values.equals(oja.values());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
