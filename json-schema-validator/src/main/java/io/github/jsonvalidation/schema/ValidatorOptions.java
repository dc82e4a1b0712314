package io.github.jsonvalidation.schema;

import java.util.Objects;

/// Settings shared by every validation a {@link JsonValidator} performs
///
/// @param assertFormats whether `format` is enforced rather than treated as an annotation
/// @param cacheSchemas whether compiled schemas are kept for reuse
/// @param defaultDraft draft used when a schema declares no recognised `$schema`
/// @param loadPolicy limits on schema loading
public record ValidatorOptions(boolean assertFormats, boolean cacheSchemas, Draft defaultDraft, LoadPolicy loadPolicy) {

  static final String FORMAT_ASSERTION_PROPERTY = "jsonschema.format.assertion";
  static final String CACHE_PROPERTY = "jsonschema.cache";
  static final String DRAFT_PROPERTY = "jsonschema.draft";

  public ValidatorOptions {
    Objects.requireNonNull(defaultDraft, "defaultDraft");
    Objects.requireNonNull(loadPolicy, "loadPolicy");
  }

  public static ValidatorOptions defaults() {
    return new ValidatorOptions(false, true, Draft.DRAFT_7, LoadPolicy.defaults());
  }

  /// Defaults overridden by `jsonschema.format.assertion`, `jsonschema.cache`
  /// and `jsonschema.draft` where those system properties are set.
  public static ValidatorOptions fromSystemProperties() {
    ValidatorOptions options = defaults();
    String formats = System.getProperty(FORMAT_ASSERTION_PROPERTY);
    if (formats != null) {
      options = options.withAssertFormats(Boolean.parseBoolean(formats.trim()));
    }
    String cache = System.getProperty(CACHE_PROPERTY);
    if (cache != null) {
      options = options.withCacheSchemas(Boolean.parseBoolean(cache.trim()));
    }
    String draft = System.getProperty(DRAFT_PROPERTY);
    if (draft != null) {
      options = options.withDefaultDraft(Draft.parse(draft));
    }
    return options;
  }

  public ValidatorOptions withAssertFormats(boolean assertFormats) {
    return new ValidatorOptions(assertFormats, cacheSchemas, defaultDraft, loadPolicy);
  }

  public ValidatorOptions withCacheSchemas(boolean cache) {
    return new ValidatorOptions(assertFormats, cache, defaultDraft, loadPolicy);
  }

  public ValidatorOptions withDefaultDraft(Draft draft) {
    return new ValidatorOptions(assertFormats, cacheSchemas, draft, loadPolicy);
  }

  public ValidatorOptions withLoadPolicy(LoadPolicy policy) {
    return new ValidatorOptions(assertFormats, cacheSchemas, defaultDraft, policy);
  }

  String summary() {
    return "assertFormats=" + assertFormats + " cacheSchemas=" + cacheSchemas
        + " defaultDraft=" + defaultDraft + " loadPolicy=" + loadPolicy;
  }
}
