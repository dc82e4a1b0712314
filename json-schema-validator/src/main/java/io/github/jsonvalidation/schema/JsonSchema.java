package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// A compiled schema or one keyword group of a compiled schema.
///
/// Instances are immutable and thread safe once {@link SchemaCompiler} returns.
/// The engine never recurses through them: each implementation reports its own
/// failures and schedules the subschemas that apply to child nodes, which the
/// {@link ValidationEngine} then pops from its work stack.
public sealed interface JsonSchema
    permits SchemaNode,
    TypeSchema,
    EnumSchema,
    ConstSchema,
    NumberSchema,
    StringSchema,
    ArraySchema,
    ObjectSchema,
    AllOfSchema,
    AnyOfSchema,
    OneOfSchema,
    NotSchema,
    ConditionalSchema,
    RefSchema,
    BooleanSchema {

  /// Checks `json`, found at `at`, against this schema.
  ///
  /// @param at location of `json` in the instance document
  /// @param json the instance node
  /// @param context receives errors and scheduled subschema frames
  void validateAt(JsonPointer at, JsonValue json, ValidationContext context);
}
