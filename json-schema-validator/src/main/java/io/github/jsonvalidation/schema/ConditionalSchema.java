package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// If/Then/Else conditional schema. `thenSchema` and `elseSchema` may be `null`.
public record ConditionalSchema(JsonSchema ifSchema, JsonSchema thenSchema,
                                JsonSchema elseSchema) implements JsonSchema {
  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    boolean ifValid = context.matches(ifSchema, json, at);
    JsonSchema branch = ifValid ? thenSchema : elseSchema;

    SchemaLogging.LOG.finer(() -> String.format(
        "Conditional path=%s ifValid=%b branch=%s",
        at, ifValid, branch == null ? "none" : (ifValid ? "then" : "else")));

    if (branch != null) {
      // Push the branch onto the same stack so its errors report like any other
      context.schedule(at, branch, json);
    }
  }
}
