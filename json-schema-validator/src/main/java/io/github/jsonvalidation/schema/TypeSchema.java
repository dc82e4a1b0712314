package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonBoolean;
import io.github.jsonvalidation.json.JsonNull;
import io.github.jsonvalidation.json.JsonNumber;
import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/// The `type` keyword: a single type name or a list of them
///
/// @param types allowed type names in declaration order
/// @param integerByValue whether `integer` accepts `1.0` (draft-06+) or only integral literals (draft-04)
public record TypeSchema(List<String> types, boolean integerByValue) implements JsonSchema {

  static final Set<String> NAMES = Set.of("null", "boolean", "object", "array", "number", "string", "integer");

  public TypeSchema {
    types = List.copyOf(types);
  }

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!accepts(json)) {
      String expected = types.size() == 1 ? types.get(0) : "one of " + types;
      context.error(at, "type", "Expected " + expected + " but found " + kindOf(json));
    }
  }

  boolean accepts(JsonValue json) {
    for (String type : types) {
      if (matches(type, json)) {
        return true;
      }
    }
    return false;
  }

  private boolean matches(String type, JsonValue json) {
    switch (type) {
      case "null":
        return json instanceof JsonNull;
      case "boolean":
        return json instanceof JsonBoolean;
      case "object":
        return json instanceof JsonObject;
      case "array":
        return json instanceof JsonArray;
      case "string":
        return json instanceof JsonString;
      case "number":
        return json instanceof JsonNumber;
      case "integer":
        return json instanceof JsonNumber && isInteger((JsonNumber) json);
      default:
        return false;
    }
  }

  private boolean isInteger(JsonNumber number) {
    if (number.isIntegralLiteral()) {
      return true;
    }
    if (!integerByValue) {
      return false;
    }
    BigDecimal value = number.toBigDecimal();
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }

  static String kindOf(JsonValue json) {
    if (json instanceof JsonNull) return "null";
    if (json instanceof JsonBoolean) return "boolean";
    if (json instanceof JsonObject) return "object";
    if (json instanceof JsonArray) return "array";
    if (json instanceof JsonString) return "string";
    return "number";
  }
}
