package io.github.jsonvalidation.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// Accumulates the errors of a single validation call.
///
/// Not thread safe; every call owns its own collector.
public final class ErrorCollector {

  private final List<ValidationError> errors = new ArrayList<>();

  public void add(ValidationError error) {
    errors.add(Objects.requireNonNull(error, "error"));
  }

  public void addAll(Collection<ValidationError> more) {
    for (ValidationError error : more) {
      add(error);
    }
  }

  /// {@return an immutable snapshot of the errors collected so far}
  public List<ValidationError> errors() {
    return List.copyOf(errors);
  }

  public boolean isEmpty() {
    return errors.isEmpty();
  }

  public int size() {
    return errors.size();
  }

  public void reset() {
    errors.clear();
  }
}
