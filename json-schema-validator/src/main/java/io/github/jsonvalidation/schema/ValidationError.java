package io.github.jsonvalidation.schema;

import java.util.Objects;

/// One reportable failure.
///
/// Constraint violations carry the pointer and property path of the offending
/// instance node and the keyword that failed. Failures that happen before the
/// engine runs (schema not found, malformed input, broken schema) carry only
/// a message.
///
/// @param pointer RFC 6901 pointer to the offending node, or `null`
/// @param property dotted property path of the offending node, or `null`
/// @param message human readable description
/// @param constraint violated keyword, or `null`
public record ValidationError(String pointer, String property, String message, String constraint) {

  public ValidationError {
    Objects.requireNonNull(message, "message");
  }

  static ValidationError at(JsonPointer at, String constraint, String message) {
    return new ValidationError(at.pointer(), at.property(), message, constraint);
  }

  static ValidationError unlocated(String message) {
    return new ValidationError(null, null, message, null);
  }

  @Override
  public String toString() {
    return (pointer == null ? "" : pointer + ": ") + message + (constraint == null ? "" : " [" + constraint + "]");
  }
}
