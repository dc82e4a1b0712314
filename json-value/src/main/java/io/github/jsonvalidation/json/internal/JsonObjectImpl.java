package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonValue;

import java.util.Collections;
import java.util.Map;

/// JsonObject implementation class
public final class JsonObjectImpl implements JsonObject {

    private final Map<String, JsonValue> members;

    public JsonObjectImpl(Map<String, JsonValue> members) {
        this.members = Collections.unmodifiableMap(members);
    }

    @Override
    public Map<String, JsonValue> members() {
        return members;
    }

    @Override
    public String toString() {
        var s = new StringBuilder("{");
        for (Map.Entry<String, JsonValue> kv : members.entrySet()) {
            s.append(Utils.quote(kv.getKey())).append(':').append(kv.getValue()).append(',');
        }
        if (!members.isEmpty()) {
            s.setLength(s.length() - 1); // trim final comma
        }
        return s.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof JsonObject ojo && members.equals(ojo.members());
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }
}
