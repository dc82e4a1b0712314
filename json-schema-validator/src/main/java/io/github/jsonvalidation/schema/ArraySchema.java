package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonValue;

import java.util.List;

/// Array schema with item validation and constraints
///
/// @param items schema for every element, or `null`; ignored when `tupleItems` is set
/// @param tupleItems positional schemas from the array form of `items`, or `null`
/// @param additionalItems schema for elements beyond `tupleItems`, or `null`
/// @param contains schema at least one element must satisfy, or `null`
public record ArraySchema(
    JsonSchema items,
    List<JsonSchema> tupleItems,
    JsonSchema additionalItems,
    Integer minItems,
    Integer maxItems,
    boolean uniqueItems,
    JsonSchema contains
) implements JsonSchema {

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!(json instanceof JsonArray)) {
      return;
    }
    List<JsonValue> values = json.values();
    int itemCount = values.size();

    if (minItems != null && itemCount < minItems) {
      context.error(at, "minItems", "Too few items: expected at least " + minItems);
    }
    if (maxItems != null && itemCount > maxItems) {
      context.error(at, "maxItems", "Too many items: expected at most " + maxItems);
    }

    if (uniqueItems) {
      checkUnique(at, values, context);
    }

    if (contains != null) {
      boolean found = false;
      for (int i = 0; i < itemCount && !found; i++) {
        found = context.matches(contains, values.get(i), at.child(i));
      }
      if (!found) {
        context.error(at, "contains", "Array must contain at least one matching element");
      }
    }

    if (tupleItems != null) {
      int positional = Math.min(tupleItems.size(), itemCount);
      for (int i = 0; i < positional; i++) {
        context.schedule(at.child(i), tupleItems.get(i), values.get(i));
      }
      if (additionalItems != null) {
        for (int i = positional; i < itemCount; i++) {
          if (additionalItems == BooleanSchema.FALSE) {
            context.error(at.child(i), "additionalItems", "Additional items not allowed");
          } else {
            context.schedule(at.child(i), additionalItems, values.get(i));
          }
        }
      }
    } else if (items != null) {
      for (int i = 0; i < itemCount; i++) {
        context.schedule(at.child(i), items, values.get(i));
      }
    }
  }

  private static void checkUnique(JsonPointer at, List<JsonValue> values, ValidationContext context) {
    for (int i = 0; i < values.size(); i++) {
      for (int j = i + 1; j < values.size(); j++) {
        if (JsonEquality.equal(values.get(i), values.get(j))) {
          context.error(at, "uniqueItems", "Array items must be unique: items " + i + " and " + j + " are equal");
          return;
        }
      }
    }
  }
}
