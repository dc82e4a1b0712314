package io.github.jsonvalidation.schema;

import java.util.List;

/// Outcome of one validation call.
///
/// @param valid `true` exactly when `errors` is empty
/// @param errors every failure, in document order
/// @param value the decoded document when valid: a `JsonValue`, or the
///        `Map`/`List` form for {@link DecodeMode#UNTYPED}; otherwise `null`
public record ValidationResult(boolean valid, List<ValidationError> errors, Object value) {

  public ValidationResult {
    errors = List.copyOf(errors);
    if (valid != errors.isEmpty()) {
      throw new IllegalArgumentException("valid=" + valid + " but " + errors.size() + " errors");
    }
  }

  public static ValidationResult success(Object value) {
    return new ValidationResult(true, List.of(), value);
  }

  public static ValidationResult failure(List<ValidationError> errors) {
    return new ValidationResult(false, errors, null);
  }

  static ValidationResult failure(ValidationError error) {
    return failure(List.of(error));
  }
}
