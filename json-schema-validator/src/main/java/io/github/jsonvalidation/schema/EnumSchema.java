package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.List;

/// Enum schema - validates that a value is in a set of allowed values
public record EnumSchema(List<JsonValue> allowedValues) implements JsonSchema {

  public EnumSchema {
    allowedValues = List.copyOf(allowedValues);
  }

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!JsonEquality.contains(allowedValues, json)) {
      context.error(at, "enum", "Not in enum: " + abbreviate(json));
    }
  }

  static String abbreviate(JsonValue json) {
    String text = json.toString();
    return text.length() > 64 ? text.substring(0, 61) + "..." : text;
  }
}
