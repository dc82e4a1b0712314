package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.List;

/// AnyOf composition - must satisfy at least one schema.
/// Failure is a single error; branch errors are not reported.
public record AnyOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    for (JsonSchema schema : schemas) {
      SchemaLogging.LOG.finest(() -> "anyOf BRANCH at " + at + ": " + schema.getClass().getSimpleName());
      if (context.matches(schema, json, at)) {
        return;
      }
    }
    context.error(at, "anyOf", "Does not match any of the " + schemas.size() + " schemas in anyOf");
  }
}
