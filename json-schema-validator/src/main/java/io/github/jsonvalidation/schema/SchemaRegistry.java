package io.github.jsonvalidation.schema;

import java.util.HashMap;
import java.util.Map;

/// Compiled schemas of one compilation keyed by canonical location (`document#pointer`).
///
/// Written only while {@link SchemaCompiler} runs; frozen before the compiled schema is published.
public final class SchemaRegistry {
  private final Map<String, JsonSchema> schemas = new HashMap<>();
  private boolean frozen;

  void register(String location, JsonSchema schema) {
    if (frozen) {
      throw new IllegalStateException("Registry is frozen");
    }
    schemas.put(location, schema);
  }

  boolean contains(String location) {
    return schemas.containsKey(location);
  }

  JsonSchema get(String location) {
    return schemas.get(location);
  }

  int size() {
    return schemas.size();
  }

  void freeze() {
    frozen = true;
  }

  @Override
  public String toString() {
    return "SchemaRegistry[" + schemas.size() + " schemas]";
  }
}
