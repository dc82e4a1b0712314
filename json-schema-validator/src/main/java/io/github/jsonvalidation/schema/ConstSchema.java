package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// Const schema - validates that a value equals a constant
public record ConstSchema(JsonValue constValue) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!JsonEquality.equal(constValue, json)) {
      context.error(at, "const", "Value must equal const value " + EnumSchema.abbreviate(constValue));
    }
  }
}
