package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.util.Locale;

/// JSON Schema drafts with their differing keyword semantics
public enum Draft {
  DRAFT_4("http://json-schema.org/draft-04/schema", "id"),
  DRAFT_6("http://json-schema.org/draft-06/schema", "$id"),
  DRAFT_7("http://json-schema.org/draft-07/schema", "$id");

  private final String metaSchema;
  private final String idKeyword;

  Draft(String metaSchema, String idKeyword) {
    this.metaSchema = metaSchema;
    this.idKeyword = idKeyword;
  }

  /// {@return the keyword that declares a base URI in this draft}
  String idKeyword() {
    return idKeyword;
  }

  /// `integer` accepts any integral value from draft-06, only integral literals before
  boolean integerByValue() {
    return this != DRAFT_4;
  }

  boolean supportsConstContainsAndPropertyNames() {
    return this != DRAFT_4;
  }

  boolean supportsConditionals() {
    return this == DRAFT_7;
  }

  /// Detects the draft of a schema document from its `$schema` keyword.
  static Draft detect(JsonValue root, Draft fallback) {
    if (root instanceof JsonObject obj && obj.members().get("$schema") instanceof JsonString s) {
      String uri = s.value();
      int hash = uri.indexOf('#');
      String stripped = (hash >= 0 ? uri.substring(0, hash) : uri).replaceFirst("^https:", "http:");
      for (Draft draft : values()) {
        if (draft.metaSchema.equals(stripped)) {
          return draft;
        }
      }
      SchemaLogging.LOG.fine(() -> "Unrecognised $schema " + uri + ", using " + fallback);
    }
    return fallback;
  }

  /// Parses `draft-04`, `draft4`, `4`, `DRAFT_4` and the like.
  static Draft parse(String text) {
    String digits = text.trim().toUpperCase(Locale.ROOT).replaceAll("[^0-9]", "");
    switch (digits) {
      case "4":
      case "04":
        return DRAFT_4;
      case "6":
      case "06":
        return DRAFT_6;
      case "7":
      case "07":
        return DRAFT_7;
      default:
        throw new IllegalArgumentException("Unsupported draft: " + text);
    }
  }
}
