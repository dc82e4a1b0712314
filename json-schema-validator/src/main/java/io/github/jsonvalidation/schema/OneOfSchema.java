package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.List;

/// OneOf composition - must satisfy exactly one schema
public record OneOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    int validCount = 0;
    for (JsonSchema schema : schemas) {
      if (context.matches(schema, json, at)) {
        validCount++;
      }
    }
    final int matched = validCount;
    SchemaLogging.LOG.finest(() -> "oneOf at " + at + ": " + matched + " of " + schemas.size() + " matched");
    if (validCount == 0) {
      context.error(at, "oneOf", "oneOf: none matched (expected exactly one of " + schemas.size() + " schemas)");
    } else if (validCount > 1) {
      context.error(at, "oneOf", "oneOf: more than one matched (" + validCount + " of " + schemas.size() + " schemas)");
    }
  }
}
