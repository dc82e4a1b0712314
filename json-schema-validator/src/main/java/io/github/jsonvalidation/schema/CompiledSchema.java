package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/// A root schema ready for validation, together with every schema it references.
///
/// Immutable and safe to share between threads.
///
/// @param location where the root schema was loaded from
/// @param draft draft the root document was compiled with
/// @param root the compiled root schema
/// @param documents number of schema documents that were loaded
public record CompiledSchema(URI location, Draft draft, JsonSchema root, int documents) {

  public CompiledSchema {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(draft, "draft");
    Objects.requireNonNull(root, "root");
  }

  /// {@return every failure of `json` against this schema, in document order}
  public List<ValidationError> validate(JsonValue json) {
    ErrorCollector errors = new ErrorCollector();
    validate(json, errors);
    return errors.errors();
  }

  /// Appends every failure of `json` against this schema to `errors`.
  public void validate(JsonValue json, ErrorCollector errors) {
    Objects.requireNonNull(json, "json");
    ValidationEngine.evaluate(root, json, JsonPointer.ROOT, errors);
  }
}
