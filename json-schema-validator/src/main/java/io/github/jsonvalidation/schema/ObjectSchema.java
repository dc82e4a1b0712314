package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Object schema with properties, required fields, and constraints
///
/// @param properties schemas for named members
/// @param required member names that must be present
/// @param patternProperties schemas for members whose name matches a pattern, all matches apply
/// @param additionalProperties schema for members matched by neither of the above, or `null`
/// @param dependentRequired array form of `dependencies`: present member to the members it requires
/// @param dependentSchemas schema form of `dependencies`: present member to the schema the whole object must satisfy
/// @param propertyNames schema every member name must satisfy, or `null`
public record ObjectSchema(
    Map<String, JsonSchema> properties,
    List<String> required,
    List<PatternProperty> patternProperties,
    JsonSchema additionalProperties,
    Integer minProperties,
    Integer maxProperties,
    Map<String, List<String>> dependentRequired,
    Map<String, JsonSchema> dependentSchemas,
    JsonSchema propertyNames
) implements JsonSchema {

  /// One `patternProperties` entry
  public record PatternProperty(String source, Pattern pattern, JsonSchema schema) {
  }

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!(json instanceof JsonObject)) {
      return;
    }
    Map<String, JsonValue> members = json.members();

    int propCount = members.size();
    if (minProperties != null && propCount < minProperties) {
      context.error(at, "minProperties", "Too few properties: expected at least " + minProperties);
    }
    if (maxProperties != null && propCount > maxProperties) {
      context.error(at, "maxProperties", "Too many properties: expected at most " + maxProperties);
    }

    // A missing member is reported at the location it should have occupied
    for (String name : required) {
      if (!members.containsKey(name)) {
        context.error(at.child(name), "required", "Missing required property: " + name);
      }
    }

    for (Map.Entry<String, List<String>> entry : dependentRequired.entrySet()) {
      if (members.containsKey(entry.getKey())) {
        for (String dependency : entry.getValue()) {
          if (!members.containsKey(dependency)) {
            context.error(at.child(dependency), "dependencies",
                "Property '" + entry.getKey() + "' requires property '" + dependency + "'");
          }
        }
      }
    }

    for (Map.Entry<String, JsonValue> entry : members.entrySet()) {
      String name = entry.getKey();
      JsonValue value = entry.getValue();
      JsonPointer child = at.child(name);

      if (propertyNames != null && !context.matches(propertyNames, JsonString.of(name), child)) {
        context.error(child, "propertyNames", "Property name '" + name + "' violates propertyNames");
      }

      boolean handled = false;
      JsonSchema propSchema = properties.get(name);
      if (propSchema != null) {
        context.schedule(child, propSchema, value);
        handled = true;
      }
      for (PatternProperty pp : patternProperties) {
        if (pp.pattern().matcher(name).find()) {
          context.schedule(child, pp.schema(), value);
          handled = true;
        }
      }
      if (!handled && additionalProperties != null) {
        if (additionalProperties == BooleanSchema.FALSE) {
          context.error(child, "additionalProperties", "Additional properties not allowed: " + name);
        } else {
          context.schedule(child, additionalProperties, value);
        }
      }
    }

    for (Map.Entry<String, JsonSchema> entry : dependentSchemas.entrySet()) {
      if (members.containsKey(entry.getKey())) {
        context.schedule(at, entry.getValue(), json);
      }
    }
  }
}
