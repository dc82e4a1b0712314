package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.List;
import java.util.Map;

/// One compiled schema object.
///
/// A failed `type` check skips the value checks (they are meaningless for the
/// wrong kind of value) but the applicators still run.
///
/// @param location canonical location of the schema (`document#pointer`)
/// @param type the `type` keyword, or `null`
/// @param valueChecks enum, const and the numeric, string, array and object keyword groups
/// @param applicators allOf, anyOf, oneOf, not and if/then/else
/// @param unknownKeywords keywords that are kept but not enforced
public record SchemaNode(
    String location,
    TypeSchema type,
    List<JsonSchema> valueChecks,
    List<JsonSchema> applicators,
    Map<String, JsonValue> unknownKeywords
) implements JsonSchema {

  public SchemaNode {
    valueChecks = List.copyOf(valueChecks);
    applicators = List.copyOf(applicators);
    unknownKeywords = Map.copyOf(unknownKeywords);
  }

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (type != null && !type.accepts(json)) {
      type.validateAt(at, json, context);
    } else {
      for (JsonSchema check : valueChecks) {
        context.schedule(at, check, json);
      }
    }
    for (JsonSchema applicator : applicators) {
      context.schedule(at, applicator, json);
    }
  }

  @Override
  public String toString() {
    return "SchemaNode[" + location + "]";
  }
}
