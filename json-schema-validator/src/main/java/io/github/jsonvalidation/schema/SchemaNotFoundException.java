package io.github.jsonvalidation.schema;

import java.util.Objects;

/// Signals that a schema identifier or location could not be resolved to content.
public final class SchemaNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String identifier;

  public SchemaNotFoundException(String identifier) {
    this(identifier, "Unable to locate schema " + identifier, null);
  }

  public SchemaNotFoundException(String identifier, String message, Throwable cause) {
    super(message, cause);
    this.identifier = Objects.requireNonNull(identifier, "identifier");
  }

  /// {@return the identifier or location that could not be found}
  public String identifier() {
    return identifier;
  }
}
