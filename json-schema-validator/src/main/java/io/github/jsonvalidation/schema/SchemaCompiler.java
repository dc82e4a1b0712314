package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonBoolean;
import io.github.jsonvalidation.json.JsonNumber;
import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// Compiles schema documents into {@link JsonSchema} graphs.
///
/// Each document is indexed once by JSON Pointer, recording the base URI in
/// effect at every position and registering `$id`/`id` aliases. Schemas are
/// then compiled on demand starting from the root: `$ref` becomes a
/// {@link RefSchema} naming the canonical location of its target, and every
/// target is queued and compiled before the compilation returns. Referenced
/// documents are loaded through the {@link SchemaLoader}, each at most once.
public final class SchemaCompiler {

  static final String FORMAT_ASSERTION_FLAG = "formatAssertion";

  /// Keywords enforced in every draft
  static final Set<String> CORE_KEYWORDS = Set.of(
      "type", "enum",
      "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf",
      "minLength", "maxLength", "pattern", "format",
      "items", "additionalItems", "minItems", "maxItems", "uniqueItems",
      "required", "properties", "patternProperties", "additionalProperties",
      "minProperties", "maxProperties", "dependencies",
      "allOf", "anyOf", "oneOf", "not");
  static final Set<String> DRAFT_6_KEYWORDS = Set.of("const", "contains", "propertyNames");
  static final Set<String> DRAFT_7_KEYWORDS = Set.of("if", "then", "else");

  /// Keywords with no validation meaning; neither enforced nor preserved
  static final Set<String> ANNOTATIONS = Set.of(
      "$schema", "$id", "id", "$comment", "title", "description", "default", "examples",
      "definitions", "readOnly", "writeOnly", "contentMediaType", "contentEncoding", FORMAT_ASSERTION_FLAG);

  /// Keywords whose value maps arbitrary names to subschemas
  static final Set<String> CONTAINER_KEYWORDS = Set.of("properties", "patternProperties", "definitions", "dependencies");

  /// Keywords whose value is instance data, never a schema
  static final Set<String> DATA_KEYWORDS = Set.of("enum", "const", "default", "examples");

  /// One indexed position of a schema document
  ///
  /// @param document canonical URI of the containing document
  /// @param pointer JSON Pointer of the position within the document
  /// @param base base URI that references at this position resolve against
  /// @param raw the value at the position
  /// @param draft draft of the containing document
  record Located(URI document, String pointer, URI base, JsonValue raw, Draft draft) {
    String key() {
      return document + "#" + pointer;
    }
  }

  /// Per-compilation session state (no static mutable fields).
  private static final class Session {
    final SchemaLoader loader;
    final ValidatorOptions options;
    final boolean assertFormats;
    final Map<URI, Draft> documents = new LinkedHashMap<>();
    final Set<URI> knownBases = new HashSet<>();
    final Map<String, Located> index = new HashMap<>();
    final SchemaRegistry registry = new SchemaRegistry();
    final Deque<Located> pending = new ArrayDeque<>();

    Session(SchemaLoader loader, ValidatorOptions options, boolean assertFormats) {
      this.loader = loader;
      this.options = options;
      this.assertFormats = assertFormats;
    }
  }

  /// Loads the document at `location` and compiles it.
  public static CompiledSchema compile(URI location, SchemaLoader loader, ValidatorOptions options) {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(loader, "loader");
    return compile(location, loader.load(location), loader, options);
  }

  /// Compiles `root`, the already decoded document at `location`.
  ///
  /// A fragment on `location` selects a subschema of the document as the root.
  ///
  /// @throws SchemaException if the schema or anything it references cannot be compiled
  public static CompiledSchema compile(URI location, JsonValue root, SchemaLoader loader, ValidatorOptions options) {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(loader, "loader");
    Objects.requireNonNull(options, "options");
    long started = System.nanoTime();
    StructuredLog.fine(LOG, "schema.compile.start", "uri", location, "options", options.summary());

    Session session = new Session(loader, options, assertFormats(options, root));
    URI document = canonicalDocument(location);
    addDocument(session, document, root);

    String fragment = location.getFragment();
    Located entry = lookup(session, document, fragment == null ? "" : fragment, location.toString());
    JsonSchema schema = compileLocated(session, entry);
    int drained = 0;
    while (!session.pending.isEmpty()) {
      Located next = session.pending.pop();
      if (!session.registry.contains(next.key())) {
        compileLocated(session, next);
        drained++;
      }
    }
    session.registry.freeze();

    final int refTargets = drained;
    StructuredLog.fine(LOG, "schema.compile.done",
        "uri", location,
        "draft", entry.draft(),
        "documents", session.documents.size(),
        "schemas", session.registry.size(),
        "refTargets", refTargets,
        "micros", (System.nanoTime() - started) / 1_000L);
    return new CompiledSchema(location, entry.draft(), schema, session.documents.size());
  }

  static boolean assertFormats(ValidatorOptions options, JsonValue root) {
    boolean assertFormats = options.assertFormats();

    // System property overrides the options (read once per compile)
    String systemProp = System.getProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY);
    if (systemProp != null) {
      assertFormats = Boolean.parseBoolean(systemProp.trim());
    }

    // Root schema flag has the highest precedence
    if (root instanceof JsonObject && root.members().get(FORMAT_ASSERTION_FLAG) instanceof JsonBoolean) {
      assertFormats = root.members().get(FORMAT_ASSERTION_FLAG).bool();
    }
    final boolean finalAssertFormats = assertFormats;
    LOG.finest(() -> "assertFormats: final format assertion setting: " + finalAssertFormats);
    return assertFormats;
  }

  // ---------------------------------------------------------------- indexing

  private static void addDocument(Session session, URI document, JsonValue root) {
    if (session.documents.size() >= session.loader.policy().maxDocuments()) {
      LOG.severe(() -> "ERROR: SCHEMA: document limit reached loading " + document);
      throw new SchemaException(SchemaException.Reason.LIMIT_EXCEEDED,
          "Maximum document count exceeded (" + session.loader.policy().maxDocuments() + ") loading " + document);
    }
    Draft draft = Draft.detect(root, session.options.defaultDraft());
    session.documents.put(document, draft);
    session.knownBases.add(document);
    int before = session.index.size();
    indexSchema(session, document, draft, root, "", document, document, "", false);
    final int indexed = session.index.size() - before;
    StructuredLog.finer(LOG, "schema.document.indexed", "uri", document, "draft", draft, "positions", indexed);
  }

  /// Records `value` and everything below it in the index.
  ///
  /// `scope`/`scopePointer` name the innermost `$id` document and the pointer where it
  /// was declared, so positions below it can also be found relative to that `$id`.
  /// A `container` is the value of a keyword such as `properties` whose members are
  /// named subschemas; its member names are never keywords.
  private static void indexSchema(Session session, URI document, Draft draft, JsonValue value, String pointer,
                                  URI base, URI scope, String scopePointer, boolean container) {
    URI ownBase = base;
    URI ownScope = scope;
    String ownScopePointer = scopePointer;
    String anchor = null;

    if (!container && value instanceof JsonObject
        && !value.members().containsKey("$ref")
        && value.members().get(draft.idKeyword()) instanceof JsonString) {
      String idText = value.members().get(draft.idKeyword()).string();
      URI idUri = parseUri(idText, document + "#" + pointer);
      URI resolved = resolveAgainst(base, idUri);
      if (resolved == null) {
        LOG.fine(() -> "Ignoring relative " + draft.idKeyword() + " " + idText + " against opaque base " + base);
      } else {
        URI resolvedDocument = canonicalDocument(resolved);
        if (!isFragmentOnly(idUri)) {
          ownBase = resolved;
          ownScope = resolvedDocument;
          ownScopePointer = pointer;
          session.knownBases.add(resolvedDocument);
        }
        String fragment = resolved.getFragment();
        if (fragment != null && !fragment.isEmpty() && !fragment.startsWith("/")) {
          anchor = resolvedDocument + "#" + fragment;
        }
      }
    }

    Located located = new Located(document, pointer, ownBase, value, draft);
    session.index.put(located.key(), located);
    if (!ownScope.equals(document)) {
      session.index.putIfAbsent(ownScope + "#" + pointer.substring(ownScopePointer.length()), located);
    }
    if (anchor != null) {
      session.index.putIfAbsent(anchor, located);
    }

    if (value instanceof JsonObject) {
      for (Map.Entry<String, JsonValue> member : value.members().entrySet()) {
        String name = member.getKey();
        if (!container && DATA_KEYWORDS.contains(name)) {
          continue;
        }
        boolean childContainer = !container && CONTAINER_KEYWORDS.contains(name);
        indexSchema(session, document, draft, member.getValue(), pointer + "/" + JsonPointer.escape(name),
            ownBase, ownScope, ownScopePointer, childContainer);
      }
    } else if (value instanceof JsonArray) {
      List<JsonValue> values = value.values();
      for (int i = 0; i < values.size(); i++) {
        indexSchema(session, document, draft, values.get(i), pointer + "/" + i,
            ownBase, ownScope, ownScopePointer, false);
      }
    }
  }

  // ------------------------------------------------------------- resolution

  private static Located lookup(Session session, URI document, String fragment, String ref) {
    String key = document + "#" + fragment;
    Located hit = session.index.get(key);
    if (hit == null && !session.knownBases.contains(document)) {
      loadDocument(session, document, ref);
      hit = session.index.get(key);
    }
    if (hit == null) {
      LOG.severe(() -> "ERROR: SCHEMA: unresolved $ref " + ref + " key=" + key);
      throw new SchemaException(SchemaException.Reason.UNRESOLVED_REF,
          "Unresolved $ref " + ref + ": nothing at " + key);
    }
    return hit;
  }

  private static void loadDocument(Session session, URI document, String ref) {
    if (session.documents.size() >= session.loader.policy().maxDocuments()) {
      throw new SchemaException(SchemaException.Reason.LIMIT_EXCEEDED,
          "Maximum document count exceeded (" + session.loader.policy().maxDocuments() + ") resolving $ref " + ref);
    }
    LOG.fine(() -> "Loading referenced document " + document + " for $ref " + ref);
    JsonValue root;
    try {
      root = session.loader.load(document);
    } catch (SchemaNotFoundException e) {
      LOG.severe(() -> "ERROR: SCHEMA: referenced document not found " + document);
      throw new SchemaException(SchemaException.Reason.UNRESOLVED_REF,
          "Unresolved $ref " + ref + ": document " + document + " not found", e);
    }
    addDocument(session, document, root);
  }

  private static Located resolveRef(Session session, Located from, String ref) {
    URI refUri = parseUri(ref, from.key());
    URI target = resolveAgainst(from.base(), refUri);
    if (target == null) {
      throw new SchemaException(SchemaException.Reason.UNRESOLVED_REF,
          "Cannot resolve relative $ref " + ref + " against " + from.base());
    }
    String fragment = target.getFragment();
    return lookup(session, canonicalDocument(target), fragment == null ? "" : fragment, ref);
  }

  /// Follows the chain of `$ref`-only schemas starting at `start`. Re-entering a
  /// location already on the chain means no real schema is ever reached.
  private static void checkRefChain(Session session, Located start) {
    List<String> resolutionStack = new ArrayList<>();
    Located cursor = start;
    while (cursor.raw() instanceof JsonObject && cursor.raw().members().get("$ref") instanceof JsonString) {
      if (resolutionStack.contains(cursor.key())) {
        String cycle = String.join(" -> ", resolutionStack) + " -> " + cursor.key();
        LOG.severe(() -> "ERROR: CYCLE: Cyclic $ref: " + cycle);
        throw new SchemaException(SchemaException.Reason.REF_CYCLE, "Cyclic $ref: " + cycle);
      }
      resolutionStack.add(cursor.key());
      cursor = resolveRef(session, cursor, cursor.raw().members().get("$ref").string());
    }
  }

  /// Resolves `ref` against `base`, or returns `null` when `base` cannot anchor a relative reference.
  static URI resolveAgainst(URI base, URI ref) {
    if (isFragmentOnly(ref)) {
      String fragment = ref.getRawFragment();
      return URI.create(canonicalDocument(base) + "#" + (fragment == null ? "" : fragment));
    }
    if (ref.isAbsolute()) {
      return ref;
    }
    if (base.isOpaque()) {
      return null;
    }
    return base.resolve(ref);
  }

  static boolean isFragmentOnly(URI uri) {
    return uri.getScheme() == null
        && uri.getRawAuthority() == null
        && (uri.getRawPath() == null || uri.getRawPath().isEmpty())
        && uri.getRawQuery() == null;
  }

  /// Strips the fragment and normalizes, writing `file:///x` as `file:/x` the way `URI.resolve` does.
  static URI canonicalDocument(URI uri) {
    String text = SchemaLoader.stripFragment(uri).toString();
    if (text.startsWith("file:///")) {
      text = "file:/" + text.substring("file:///".length());
    }
    return URI.create(text);
  }

  private static URI parseUri(String text, String where) {
    try {
      return new URI(text);
    } catch (URISyntaxException e) {
      LOG.severe(() -> "ERROR: SCHEMA: invalid URI " + text + " at " + where);
      throw new SchemaException(SchemaException.Reason.MALFORMED, "Invalid URI reference " + text + " at " + where, e);
    }
  }

  // ------------------------------------------------------------ compilation

  private static JsonSchema compileLocated(Session session, Located located) {
    JsonSchema existing = session.registry.get(located.key());
    if (existing != null) {
      return existing;
    }
    JsonSchema compiled = compileSchema(session, located);
    session.registry.register(located.key(), compiled);
    return compiled;
  }

  private static JsonSchema compileSchema(Session session, Located located) {
    JsonValue raw = located.raw();
    if (raw instanceof JsonBoolean) {
      return BooleanSchema.of(raw.bool());
    }
    if (!(raw instanceof JsonObject)) {
      throw malformed(located, "schema must be an object or boolean");
    }
    Map<String, JsonValue> members = raw.members();

    // Siblings of $ref are ignored
    JsonValue refValue = members.get("$ref");
    if (refValue != null) {
      if (!(refValue instanceof JsonString)) {
        throw malformed(located, "$ref must be a string");
      }
      String ref = refValue.string();
      checkRefChain(session, located);
      Located target = resolveRef(session, located, ref);
      if (!session.registry.contains(target.key())) {
        session.pending.push(target);
      }
      LOG.finer(() -> "Compiled $ref " + ref + " at " + located.key() + " -> " + target.key());
      return new RefSchema(ref, target.key(), session.registry);
    }
    return compileObject(session, located, members);
  }

  private static SchemaNode compileObject(Session session, Located located, Map<String, JsonValue> m) {
    Draft draft = located.draft();
    TypeSchema type = m.containsKey("type") ? compileType(located, m.get("type"), draft) : null;
    List<JsonSchema> valueChecks = new ArrayList<>();
    List<JsonSchema> applicators = new ArrayList<>();

    JsonValue enumValue = m.get("enum");
    if (enumValue != null) {
      if (!(enumValue instanceof JsonArray)) {
        throw malformed(located, "enum must be an array");
      }
      valueChecks.add(new EnumSchema(enumValue.values()));
    }
    if (draft.supportsConstContainsAndPropertyNames() && m.containsKey("const")) {
      valueChecks.add(new ConstSchema(m.get("const")));
    }

    NumberSchema number = compileNumber(located, m);
    if (number != null) valueChecks.add(number);
    StringSchema string = compileString(session, located, m);
    if (string != null) valueChecks.add(string);
    ArraySchema array = compileArray(session, located, m);
    if (array != null) valueChecks.add(array);
    ObjectSchema object = compileObjectKeywords(session, located, m);
    if (object != null) valueChecks.add(object);

    if (m.containsKey("allOf")) {
      applicators.add(new AllOfSchema(childList(session, located, m, "allOf")));
    }
    if (m.containsKey("anyOf")) {
      applicators.add(new AnyOfSchema(childList(session, located, m, "anyOf")));
    }
    if (m.containsKey("oneOf")) {
      applicators.add(new OneOfSchema(childList(session, located, m, "oneOf")));
    }
    if (m.containsKey("not")) {
      applicators.add(new NotSchema(child(session, located, "not")));
    }
    if (draft.supportsConditionals() && m.containsKey("if")) {
      JsonSchema ifSchema = child(session, located, "if");
      JsonSchema thenSchema = m.containsKey("then") ? child(session, located, "then") : null;
      JsonSchema elseSchema = m.containsKey("else") ? child(session, located, "else") : null;
      applicators.add(new ConditionalSchema(ifSchema, thenSchema, elseSchema));
    }

    Map<String, JsonValue> unknown = new LinkedHashMap<>();
    for (Map.Entry<String, JsonValue> entry : m.entrySet()) {
      if (!isKnown(entry.getKey(), draft)) {
        unknown.put(entry.getKey(), entry.getValue());
      }
    }
    if (!unknown.isEmpty()) {
      LOG.finer(() -> "Preserving unknown keywords " + unknown.keySet() + " at " + located.key());
    }
    return new SchemaNode(located.key(), type, valueChecks, applicators, unknown);
  }

  static boolean isKnown(String keyword, Draft draft) {
    return CORE_KEYWORDS.contains(keyword)
        || ANNOTATIONS.contains(keyword)
        || (draft.supportsConstContainsAndPropertyNames() && DRAFT_6_KEYWORDS.contains(keyword))
        || (draft.supportsConditionals() && DRAFT_7_KEYWORDS.contains(keyword));
  }

  private static TypeSchema compileType(Located located, JsonValue value, Draft draft) {
    List<String> types = new ArrayList<>();
    if (value instanceof JsonString) {
      types.add(value.string());
    } else if (value instanceof JsonArray) {
      for (JsonValue item : value.values()) {
        if (!(item instanceof JsonString)) {
          throw malformed(located, "type array must contain only strings");
        }
        types.add(item.string());
      }
    } else {
      throw malformed(located, "type must be a string or an array of strings");
    }
    for (String type : types) {
      if (!TypeSchema.NAMES.contains(type)) {
        throw malformed(located, "unknown type '" + type + "'");
      }
    }
    return new TypeSchema(types, draft.integerByValue());
  }

  private static NumberSchema compileNumber(Located located, Map<String, JsonValue> m) {
    BigDecimal minimum = number(located, m, "minimum");
    BigDecimal maximum = number(located, m, "maximum");
    BigDecimal exclusiveMinimum = null;
    BigDecimal exclusiveMaximum = null;

    // Boolean form (draft-04) turns the plain bound exclusive, numeric form is a bound of its own
    JsonValue exMin = m.get("exclusiveMinimum");
    if (exMin instanceof JsonBoolean) {
      if (exMin.bool() && minimum != null) {
        exclusiveMinimum = minimum;
        minimum = null;
      }
    } else if (exMin != null) {
      exclusiveMinimum = number(located, m, "exclusiveMinimum");
    }
    JsonValue exMax = m.get("exclusiveMaximum");
    if (exMax instanceof JsonBoolean) {
      if (exMax.bool() && maximum != null) {
        exclusiveMaximum = maximum;
        maximum = null;
      }
    } else if (exMax != null) {
      exclusiveMaximum = number(located, m, "exclusiveMaximum");
    }

    BigDecimal multipleOf = number(located, m, "multipleOf");
    if (multipleOf != null && multipleOf.signum() <= 0) {
      throw malformed(located, "multipleOf must be greater than 0");
    }
    if (minimum == null && maximum == null && exclusiveMinimum == null && exclusiveMaximum == null && multipleOf == null) {
      return null;
    }
    return new NumberSchema(minimum, maximum, exclusiveMinimum, exclusiveMaximum, multipleOf);
  }

  private static StringSchema compileString(Session session, Located located, Map<String, JsonValue> m) {
    Integer minLength = nonNegativeInt(located, m, "minLength");
    Integer maxLength = nonNegativeInt(located, m, "maxLength");

    Pattern pattern = null;
    String patternSource = null;
    JsonValue patternValue = m.get("pattern");
    if (patternValue != null) {
      if (!(patternValue instanceof JsonString)) {
        throw malformed(located, "pattern must be a string");
      }
      patternSource = patternValue.string();
      pattern = EcmaRegex.compile(patternSource, located.key() + "/pattern");
    }

    FormatValidator formatValidator = null;
    JsonValue formatValue = m.get("format");
    if (formatValue instanceof JsonString && session.assertFormats) {
      String name = formatValue.string();
      formatValidator = Format.byName(name);
      if (formatValidator == null) {
        LOG.fine(() -> "Unknown format '" + name + "' at " + located.key() + " is not asserted");
      }
    }

    if (minLength == null && maxLength == null && pattern == null && formatValidator == null) {
      return null;
    }
    return new StringSchema(minLength, maxLength, pattern, patternSource, formatValidator);
  }

  private static ArraySchema compileArray(Session session, Located located, Map<String, JsonValue> m) {
    JsonSchema items = null;
    List<JsonSchema> tupleItems = null;
    JsonValue itemsValue = m.get("items");
    if (itemsValue instanceof JsonArray) {
      tupleItems = childList(session, located, m, "items");
    } else if (itemsValue != null) {
      items = child(session, located, "items");
    }
    JsonSchema additionalItems = m.containsKey("additionalItems") ? child(session, located, "additionalItems") : null;
    Integer minItems = nonNegativeInt(located, m, "minItems");
    Integer maxItems = nonNegativeInt(located, m, "maxItems");

    boolean uniqueItems = false;
    JsonValue uniqueValue = m.get("uniqueItems");
    if (uniqueValue != null) {
      if (!(uniqueValue instanceof JsonBoolean)) {
        throw malformed(located, "uniqueItems must be a boolean");
      }
      uniqueItems = uniqueValue.bool();
    }
    JsonSchema contains = located.draft().supportsConstContainsAndPropertyNames() && m.containsKey("contains")
        ? child(session, located, "contains") : null;

    if (items == null && tupleItems == null && minItems == null && maxItems == null && !uniqueItems && contains == null) {
      return null;
    }
    return new ArraySchema(items, tupleItems, additionalItems, minItems, maxItems, uniqueItems, contains);
  }

  private static ObjectSchema compileObjectKeywords(Session session, Located located, Map<String, JsonValue> m) {
    boolean any = false;

    Map<String, JsonSchema> properties = new LinkedHashMap<>();
    JsonValue propertiesValue = m.get("properties");
    if (propertiesValue != null) {
      any = true;
      for (String name : objectMember(located, propertiesValue, "properties").keySet()) {
        properties.put(name, child(session, located, "properties/" + JsonPointer.escape(name)));
      }
    }

    List<String> required = new ArrayList<>();
    JsonValue requiredValue = m.get("required");
    if (requiredValue != null) {
      any = true;
      required.addAll(stringArray(located, requiredValue, "required"));
    }

    List<ObjectSchema.PatternProperty> patternProperties = new ArrayList<>();
    JsonValue patternValue = m.get("patternProperties");
    if (patternValue != null) {
      any = true;
      for (String source : objectMember(located, patternValue, "patternProperties").keySet()) {
        String relative = "patternProperties/" + JsonPointer.escape(source);
        Pattern pattern = EcmaRegex.compile(source, located.key() + "/" + relative);
        patternProperties.add(new ObjectSchema.PatternProperty(source, pattern, child(session, located, relative)));
      }
    }

    JsonSchema additionalProperties = null;
    if (m.containsKey("additionalProperties")) {
      any = true;
      additionalProperties = child(session, located, "additionalProperties");
    }

    Integer minProperties = nonNegativeInt(located, m, "minProperties");
    Integer maxProperties = nonNegativeInt(located, m, "maxProperties");
    any |= minProperties != null || maxProperties != null;

    Map<String, List<String>> dependentRequired = new LinkedHashMap<>();
    Map<String, JsonSchema> dependentSchemas = new LinkedHashMap<>();
    JsonValue dependenciesValue = m.get("dependencies");
    if (dependenciesValue != null) {
      any = true;
      for (Map.Entry<String, JsonValue> entry : objectMember(located, dependenciesValue, "dependencies").entrySet()) {
        if (entry.getValue() instanceof JsonArray) {
          dependentRequired.put(entry.getKey(), stringArray(located, entry.getValue(), "dependencies"));
        } else {
          dependentSchemas.put(entry.getKey(),
              child(session, located, "dependencies/" + JsonPointer.escape(entry.getKey())));
        }
      }
    }

    JsonSchema propertyNames = null;
    if (located.draft().supportsConstContainsAndPropertyNames() && m.containsKey("propertyNames")) {
      any = true;
      propertyNames = child(session, located, "propertyNames");
    }

    if (!any) {
      return null;
    }
    return new ObjectSchema(properties, List.copyOf(required), List.copyOf(patternProperties), additionalProperties,
        minProperties, maxProperties, dependentRequired, dependentSchemas, propertyNames);
  }

  /// Compiles the subschema at `relative`, a pointer suffix with escaped segments.
  private static JsonSchema child(Session session, Located parent, String relative) {
    Located located = session.index.get(parent.document() + "#" + parent.pointer() + "/" + relative);
    if (located == null) {
      throw malformed(parent, "no subschema at " + relative);
    }
    return compileLocated(session, located);
  }

  private static List<JsonSchema> childList(Session session, Located parent, Map<String, JsonValue> m, String keyword) {
    JsonValue value = m.get(keyword);
    if (!(value instanceof JsonArray)) {
      throw malformed(parent, keyword + " must be an array of schemas");
    }
    List<JsonSchema> schemas = new ArrayList<>();
    for (int i = 0; i < value.values().size(); i++) {
      schemas.add(child(session, parent, keyword + "/" + i));
    }
    return List.copyOf(schemas);
  }

  private static Map<String, JsonValue> objectMember(Located located, JsonValue value, String keyword) {
    if (!(value instanceof JsonObject)) {
      throw malformed(located, keyword + " must be an object");
    }
    return value.members();
  }

  private static List<String> stringArray(Located located, JsonValue value, String keyword) {
    if (!(value instanceof JsonArray)) {
      throw malformed(located, keyword + " must be an array of strings");
    }
    List<String> strings = new ArrayList<>();
    for (JsonValue item : value.values()) {
      if (!(item instanceof JsonString)) {
        throw malformed(located, keyword + " must be an array of strings");
      }
      strings.add(item.string());
    }
    return List.copyOf(strings);
  }

  private static BigDecimal number(Located located, Map<String, JsonValue> m, String keyword) {
    JsonValue value = m.get(keyword);
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonNumber)) {
      throw malformed(located, keyword + " must be a number");
    }
    return ((JsonNumber) value).toBigDecimal();
  }

  private static Integer nonNegativeInt(Located located, Map<String, JsonValue> m, String keyword) {
    BigDecimal value = number(located, m, keyword);
    if (value == null) {
      return null;
    }
    if (value.signum() < 0 || (value.signum() != 0 && value.stripTrailingZeros().scale() > 0)) {
      throw malformed(located, keyword + " must be a non-negative integer");
    }
    return value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0 ? Integer.MAX_VALUE : value.intValue();
  }

  private static SchemaException malformed(Located located, String problem) {
    LOG.severe(() -> "ERROR: SCHEMA: malformed at " + located.key() + ": " + problem);
    return new SchemaException(SchemaException.Reason.MALFORMED, "Malformed schema at " + located.key() + ": " + problem);
  }

  private SchemaCompiler() {}
}
