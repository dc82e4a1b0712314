package io.github.jsonvalidation.schema;

import java.util.Objects;

/// Exception signalling that a schema cannot be compiled, with a typed reason
public final class SchemaException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Reason reason;

  SchemaException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  SchemaException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    /// A keyword value has the wrong shape, or a document is not valid JSON
    MALFORMED,
    /// A `$ref` target does not exist
    UNRESOLVED_REF,
    /// A chain of `$ref`s loops back on itself without reaching a real schema
    REF_CYCLE,
    /// A `pattern` or `patternProperties` key is not a usable regular expression
    INVALID_PATTERN,
    /// A referenced document could not be read
    LOAD_FAILED,
    /// A {@link LoadPolicy} limit was exceeded
    LIMIT_EXCEEDED
  }
}
