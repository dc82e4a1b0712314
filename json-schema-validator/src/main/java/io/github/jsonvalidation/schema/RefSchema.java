package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// Reference schema for `$ref`, resolved through the registry of its compilation
///
/// @param ref the reference as written
/// @param target canonical location of the referenced schema (`document#pointer`)
/// @param registry every schema of the compilation by canonical location
public record RefSchema(String ref, String target, SchemaRegistry registry) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    JsonSchema resolved = registry.get(target);
    if (resolved == null) {
      // The compiler compiles every target before it returns
      throw new IllegalStateException("Unresolved $ref " + ref + " -> " + target);
    }
    SchemaLogging.LOG.finest(() -> "RefSchema.validateAt: " + ref + " -> " + target + " at " + at);
    // Stay on the SAME traversal stack
    context.schedule(at, resolved, json);
  }

  @Override
  public String toString() {
    return "RefSchema[" + ref + " -> " + target + "]";
  }
}
