package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// Not composition - inverts the validation result of the inner schema
public record NotSchema(JsonSchema schema) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (context.matches(schema, json, at)) {
      context.error(at, "not", "Schema should not match");
    }
  }
}
