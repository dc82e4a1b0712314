package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// The boolean schemas: `true` accepts every value, `false` rejects every value
public record BooleanSchema(boolean allow) implements JsonSchema {
  static final BooleanSchema TRUE = new BooleanSchema(true);
  static final BooleanSchema FALSE = new BooleanSchema(false);

  static BooleanSchema of(boolean allow) {
    return allow ? TRUE : FALSE;
  }

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!allow) {
      context.error(at, "false", "No value is allowed here");
    }
  }
}
