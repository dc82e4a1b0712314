package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonNumber;
import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonValue;

import java.util.List;
import java.util.Map;

/// Structural equality as JSON Schema defines it for `enum`, `const` and `uniqueItems`.
///
/// Numbers compare by mathematical value, so `1`, `1.0` and `1e0` are equal.
/// Object member order is ignored. All other values compare by kind and content.
final class JsonEquality {

  static boolean equal(JsonValue a, JsonValue b) {
    if (a == b) {
      return true;
    }
    if (a instanceof JsonNumber && b instanceof JsonNumber) {
      return ((JsonNumber) a).toBigDecimal().compareTo(((JsonNumber) b).toBigDecimal()) == 0;
    }
    if (a instanceof JsonArray && b instanceof JsonArray) {
      List<JsonValue> left = a.values();
      List<JsonValue> right = b.values();
      if (left.size() != right.size()) {
        return false;
      }
      for (int i = 0; i < left.size(); i++) {
        if (!equal(left.get(i), right.get(i))) {
          return false;
        }
      }
      return true;
    }
    if (a instanceof JsonObject && b instanceof JsonObject) {
      Map<String, JsonValue> left = a.members();
      Map<String, JsonValue> right = b.members();
      if (left.size() != right.size()) {
        return false;
      }
      for (Map.Entry<String, JsonValue> entry : left.entrySet()) {
        JsonValue other = right.get(entry.getKey());
        if (other == null || !equal(entry.getValue(), other)) {
          return false;
        }
      }
      return true;
    }
    // strings, booleans and null: the value classes implement exact equality
    return a.equals(b);
  }

  static boolean contains(List<JsonValue> values, JsonValue candidate) {
    for (JsonValue value : values) {
      if (equal(value, candidate)) {
        return true;
      }
    }
    return false;
  }

  private JsonEquality() {}
}
