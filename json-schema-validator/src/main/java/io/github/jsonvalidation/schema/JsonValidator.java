package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import io.github.jsonvalidation.json.JsonParseException;
import io.github.jsonvalidation.json.JsonValue;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// Validates JSON text against schemas named by identifier.
///
/// Every call goes through the same four stages: locate the schema, decode the
/// document, compile the schema (once per location while caching is enabled) and
/// run the engine. A failure in any of the first three stages ends the call with
/// a single error; the engine reports every violation it finds.
///
/// ```java
/// JsonValidator validator = new JsonValidator(new DirectorySchemaLocator(Path.of("schemas")));
/// ValidationResult result = validator.validate("{\"id\": 7}", "user.json");
/// if (!result.valid()) {
///   result.errors().forEach(e -> System.out.println(e.pointer() + " " + e.message()));
/// }
/// ```
///
/// Instances are thread safe. Results never share state between calls.
public final class JsonValidator {

  private final SchemaLoader loader;
  private final ValidatorOptions options;
  private final Map<URI, CompiledSchema> cache = new ConcurrentHashMap<>();

  public JsonValidator(SchemaLocator locator) {
    this(locator, ValidatorOptions.defaults());
  }

  public JsonValidator(SchemaLocator locator, ValidatorOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.loader = new SchemaLoader(Objects.requireNonNull(locator, "locator"), options.loadPolicy());
    LOG.fine(() -> "JsonValidator created: " + options.summary());
  }

  public ValidatorOptions options() {
    return options;
  }

  /// Validates `json` against the schema `schemaId`, returning the decoded {@link JsonValue} when valid.
  public ValidationResult validate(String json, String schemaId) {
    return validate(json, schemaId, DecodeMode.TYPED);
  }

  /// Validates `json` against the schema `schemaId`.
  ///
  /// @param mode whether a valid result carries the `JsonValue` or its `Map`/`List` form
  public ValidationResult validate(String json, String schemaId, DecodeMode mode) {
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(schemaId, "schemaId");
    Objects.requireNonNull(mode, "mode");
    long started = System.nanoTime();

    URI location;
    try {
      location = loader.locate(schemaId);
    } catch (SchemaNotFoundException e) {
      LOG.severe(() -> "ERROR: LOCATE: " + e.getMessage());
      return finish(schemaId, started, ValidationResult.failure(
          ValidationError.unlocated("Unable to locate schema " + schemaId)));
    }

    JsonValue document;
    try {
      document = Json.parse(json);
    } catch (JsonParseException e) {
      LOG.severe(() -> "ERROR: DECODE: [" + e.code() + "] " + e.getMessage());
      return finish(schemaId, started, ValidationResult.failure(
          ValidationError.unlocated("[" + e.code() + "] " + e.getMessage())));
    }

    CompiledSchema schema;
    try {
      schema = compile(location);
    } catch (SchemaNotFoundException e) {
      LOG.severe(() -> "ERROR: LOAD: " + e.getMessage());
      return finish(schemaId, started, ValidationResult.failure(
          ValidationError.unlocated("Unable to locate schema " + schemaId)));
    } catch (SchemaException e) {
      LOG.severe(() -> "ERROR: COMPILE: " + e.reason() + " " + e.getMessage());
      return finish(schemaId, started, ValidationResult.failure(
          ValidationError.unlocated(e.getMessage())));
    }

    List<ValidationError> errors = schema.validate(document);
    if (!errors.isEmpty()) {
      return finish(schemaId, started, ValidationResult.failure(errors));
    }
    Object value = mode == DecodeMode.UNTYPED ? Json.toUntyped(Json.parse(json)) : document;
    return finish(schemaId, started, ValidationResult.success(value));
  }

  /// Validates a request body, where an absent body may be acceptable.
  ///
  /// With `emptyIsValid`, a `null` or empty body is valid and carries no value.
  public ValidationResult validateBody(String body, String schemaId, boolean emptyIsValid) {
    return validateBody(body, schemaId, emptyIsValid, DecodeMode.TYPED);
  }

  public ValidationResult validateBody(String body, String schemaId, boolean emptyIsValid, DecodeMode mode) {
    if (body == null || body.isEmpty()) {
      if (emptyIsValid) {
        LOG.finer(() -> "Empty body accepted for schema " + schemaId);
        return ValidationResult.success(null);
      }
      return validate(body == null ? "" : body, schemaId, mode);
    }
    return validate(body, schemaId, mode);
  }

  /// {@return the compiled schema for `schemaId`, from the cache when enabled}
  ///
  /// @throws SchemaNotFoundException if the schema cannot be located or loaded
  /// @throws SchemaException if the schema cannot be compiled
  public CompiledSchema compile(String schemaId) {
    return compile(loader.locate(schemaId));
  }

  /// {@return number of compiled schemas held in the cache}
  public int cachedSchemas() {
    return cache.size();
  }

  private CompiledSchema compile(URI location) {
    if (!options.cacheSchemas()) {
      return SchemaCompiler.compile(location, loader, options);
    }
    CompiledSchema cached = cache.get(location);
    if (cached != null) {
      LOG.fine(() -> "Schema cache hit: " + location);
      return cached;
    }
    return cache.computeIfAbsent(location, uri -> SchemaCompiler.compile(uri, loader, options));
  }

  private static ValidationResult finish(String schemaId, long started, ValidationResult result) {
    StructuredLog.fine(LOG, "validate",
        "schema", schemaId,
        "valid", result.valid(),
        "errors", result.errors().size(),
        "micros", (System.nanoTime() - started) / 1_000L);
    return result;
  }
}
