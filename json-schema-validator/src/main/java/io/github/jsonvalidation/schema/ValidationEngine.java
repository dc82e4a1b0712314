package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// Walks an instance against a compiled schema with an explicit work stack,
/// so instance depth never turns into Java stack depth.
///
/// Frames a schema schedules are pushed in reverse, which makes them pop in the
/// order they were scheduled and keeps errors in document order.
public final class ValidationEngine {

  static final int WARNING_THRESHOLD = 10_000;

  /// Validates `json`, located at `at`, against `schema`, appending every failure to `errors`.
  public static void evaluate(JsonSchema schema, JsonValue json, JsonPointer at, ErrorCollector errors) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(at, "at");
    Objects.requireNonNull(errors, "errors");
    run(schema, json, at, errors, new HashSet<>());
  }

  static void run(JsonSchema schema, JsonValue json, JsonPointer at, ErrorCollector errors, Set<ValidationKey> inFlight) {
    Deque<ValidationFrame> stack = new ArrayDeque<>();
    Set<ValidationKey> visited = new HashSet<>();
    ValidationContext context = new ValidationContext(errors, inFlight);
    stack.push(new ValidationFrame(at, schema, json));

    int iterationCount = 0;
    int maxDepthObserved = 0;
    while (!stack.isEmpty()) {
      iterationCount++;
      if (stack.size() > maxDepthObserved) maxDepthObserved = stack.size();
      if (iterationCount % WARNING_THRESHOLD == 0) {
        final int processed = iterationCount;
        final int pending = stack.size();
        final int maxDepth = maxDepthObserved;
        LOG.warning(() -> "PERFORMANCE WARNING: Validation stack processed=" + processed + " pending=" + pending + " maxDepth=" + maxDepth);
      }

      ValidationFrame frame = stack.pop();
      if (!visited.add(ValidationKey.of(frame))) {
        LOG.finest(() -> "SKIP " + frame.at() + "   schema=" + frame.schema().getClass().getSimpleName());
        continue;
      }
      LOG.finest(() -> "POP " + frame.at() + "   schema=" + frame.schema().getClass().getSimpleName());
      frame.schema().validateAt(frame.at(), frame.json(), context);

      List<ValidationFrame> children = context.drainScheduled();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  private ValidationEngine() {}
}
