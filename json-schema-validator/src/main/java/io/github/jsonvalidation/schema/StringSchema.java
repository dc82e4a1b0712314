package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.util.regex.Pattern;

/// String schema with length, pattern and format constraints
///
/// @param minLength minimum length in code points, or `null`
/// @param maxLength maximum length in code points, or `null`
/// @param pattern compiled pattern, or `null`
/// @param patternSource pattern as written in the schema, for messages
/// @param formatValidator asserted format, or `null` when format is only an annotation
public record StringSchema(
    Integer minLength,
    Integer maxLength,
    Pattern pattern,
    String patternSource,
    FormatValidator formatValidator
) implements JsonSchema {

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!(json instanceof JsonString)) {
      return;
    }
    String value = ((JsonString) json).value();

    // Length counts code points, so a surrogate pair is one character
    if (minLength != null || maxLength != null) {
      int length = value.codePointCount(0, value.length());
      if (minLength != null && length < minLength) {
        context.error(at, "minLength", "String too short: expected at least " + minLength + " characters");
      }
      if (maxLength != null && length > maxLength) {
        context.error(at, "maxLength", "String too long: expected at most " + maxLength + " characters");
      }
    }

    // Unanchored matching - uses find() instead of matches()
    if (pattern != null && !pattern.matcher(value).find()) {
      context.error(at, "pattern", "Pattern mismatch: " + patternSource);
    }

    if (formatValidator != null && !formatValidator.test(value)) {
      context.error(at, "format", "Invalid format '" + formatValidator.keyword() + "'");
    }
  }
}
