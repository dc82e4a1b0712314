package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// What a {@link JsonSchema} sees of the engine while it validates one frame:
/// somewhere to report errors, a way to schedule subschemas, and isolated
/// sub-evaluation for the keywords that only need to know whether a subschema passes.
public final class ValidationContext {

  private final ErrorCollector errors;
  private final Set<ValidationKey> inFlight;
  private final List<ValidationFrame> scheduled = new ArrayList<>();

  ValidationContext(ErrorCollector errors, Set<ValidationKey> inFlight) {
    this.errors = errors;
    this.inFlight = inFlight;
  }

  void error(JsonPointer at, String constraint, String message) {
    errors.add(ValidationError.at(at, constraint, message));
  }

  /// Queues `schema` against `json`. Frames scheduled by one schema run in the order they were scheduled.
  void schedule(JsonPointer at, JsonSchema schema, JsonValue json) {
    if (schema == BooleanSchema.TRUE) {
      return;
    }
    scheduled.add(new ValidationFrame(at, schema, json));
  }

  /// {@return whether `json` satisfies `schema`} Errors of the sub-evaluation are discarded.
  ///
  /// A sub-evaluation that re-enters itself for the same instance node is
  /// treated as passing: such a loop can never make progress in the instance.
  boolean matches(JsonSchema schema, JsonValue json, JsonPointer at) {
    if (schema == BooleanSchema.TRUE) return true;
    if (schema == BooleanSchema.FALSE) return false;
    ValidationKey key = new ValidationKey(schema, json, at.pointer());
    if (!inFlight.add(key)) {
      LOG.finer(() -> "Sub-evaluation loop at " + at.pointer() + " treated as match");
      return true;
    }
    try {
      ErrorCollector branch = new ErrorCollector();
      ValidationEngine.run(schema, json, at, branch, inFlight);
      return branch.isEmpty();
    } finally {
      inFlight.remove(key);
    }
  }

  List<ValidationFrame> drainScheduled() {
    if (scheduled.isEmpty()) {
      return List.of();
    }
    List<ValidationFrame> out = List.copyOf(scheduled);
    scheduled.clear();
    return out;
  }
}
