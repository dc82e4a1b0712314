package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.List;

/// AllOf composition - must satisfy all schemas; every branch's errors are reported
public record AllOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    for (JsonSchema schema : schemas) {
      context.schedule(at, schema, json);
    }
  }
}
