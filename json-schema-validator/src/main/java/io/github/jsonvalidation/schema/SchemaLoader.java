package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import io.github.jsonvalidation.json.JsonParseException;
import io.github.jsonvalidation.json.JsonValue;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// Turns schema identifiers and locations into schema documents.
///
/// Identifier lookup is delegated to a {@link SchemaLocator}. Content comes
/// from the locator when it serves the location itself, otherwise `file:`
/// locations are read from disk and `classpath:` locations from the class loader.
/// No network access is ever attempted.
public final class SchemaLoader {
  static final String CLASSPATH_SCHEME = "classpath";

  private final SchemaLocator locator;
  private final LoadPolicy policy;

  public SchemaLoader(SchemaLocator locator, LoadPolicy policy) {
    this.locator = Objects.requireNonNull(locator, "locator");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public LoadPolicy policy() {
    return policy;
  }

  /// {@return the location the locator gives for `identifier`}
  ///
  /// @throws SchemaNotFoundException naming the identifier, whatever the locator's failure was
  public URI locate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    URI location;
    try {
      location = locator.locate(identifier);
    } catch (SchemaNotFoundException e) {
      LOG.fine(() -> "locate: not found id=" + identifier + " cause=" + e.getMessage());
      throw e.identifier().equals(identifier) ? e
          : new SchemaNotFoundException(identifier, "Unable to locate schema " + identifier, e);
    } catch (RuntimeException e) {
      LOG.fine(() -> "locate: locator failed id=" + identifier + " cause=" + e);
      throw new SchemaNotFoundException(identifier, "Unable to locate schema " + identifier, e);
    }
    if (location == null) {
      throw new SchemaNotFoundException(identifier);
    }
    StructuredLog.finer(LOG, "schema.located", "id", identifier, "uri", location);
    return location;
  }

  /// {@return the raw text of the schema document at `location`}
  ///
  /// @throws SchemaNotFoundException if nothing exists at `location`
  /// @throws SchemaException with `LOAD_FAILED` on read errors or an unsupported scheme,
  ///         `LIMIT_EXCEEDED` when the document is larger than the policy allows
  public String read(URI location) {
    Objects.requireNonNull(location, "location");
    URI document = stripFragment(location);
    Optional<String> served = locator.content(document);
    String text;
    if (served.isPresent()) {
      text = served.get();
    } else if ("file".equalsIgnoreCase(document.getScheme())) {
      text = readFile(document);
    } else if (CLASSPATH_SCHEME.equalsIgnoreCase(document.getScheme())) {
      text = readClasspath(document);
    } else {
      LOG.severe(() -> "ERROR: LOAD: unsupported scheme " + document);
      throw new SchemaException(SchemaException.Reason.LOAD_FAILED, "Unsupported schema location: " + document);
    }
    long size = text.getBytes(StandardCharsets.UTF_8).length;
    if (size > policy.maxDocumentBytes()) {
      throw new SchemaException(SchemaException.Reason.LIMIT_EXCEEDED,
          "Schema document exceeds maxDocumentBytes at " + document + ": " + size);
    }
    return text;
  }

  /// {@return the decoded schema document at `location`}
  ///
  /// @throws SchemaException with `MALFORMED` when the document is not valid JSON
  public JsonValue load(URI location) {
    String text = read(location);
    try {
      return Json.parse(text);
    } catch (JsonParseException e) {
      LOG.severe(() -> "ERROR: LOAD: malformed schema document " + location + ": " + e.getMessage());
      throw new SchemaException(SchemaException.Reason.MALFORMED,
          "Schema document " + stripFragment(location) + " is not valid JSON: [" + e.code() + "] " + e.getMessage(), e);
    }
  }

  private String readFile(URI document) {
    Path path = Path.of(document);
    try {
      long size = Files.size(path);
      if (size > policy.maxDocumentBytes()) {
        throw new SchemaException(SchemaException.Reason.LIMIT_EXCEEDED,
            "Schema document exceeds maxDocumentBytes at " + document + ": " + size);
      }
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new SchemaNotFoundException(document.toString(), "No such schema file: " + document, e);
    } catch (IOException e) {
      LOG.severe(() -> "ERROR: IO reading schema " + path + ": " + e.getMessage());
      throw new SchemaException(SchemaException.Reason.LOAD_FAILED, "IO reading schema " + document + ": " + e.getMessage(), e);
    }
  }

  private String readClasspath(URI document) {
    String resource = document.getSchemeSpecificPart();
    while (resource.startsWith("/")) {
      resource = resource.substring(1);
    }
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) {
      cl = SchemaLoader.class.getClassLoader();
    }
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        throw new SchemaNotFoundException(document.toString(), "No such schema resource: " + document, null);
      }
      byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, policy.maxDocumentBytes() + 1L));
      if (bytes.length > policy.maxDocumentBytes()) {
        throw new SchemaException(SchemaException.Reason.LIMIT_EXCEEDED,
            "Schema document exceeds maxDocumentBytes at " + document);
      }
      return new String(bytes, StandardCharsets.UTF_8);
    } catch (IOException e) {
      LOG.severe(() -> "ERROR: IO reading schema resource " + document + ": " + e.getMessage());
      throw new SchemaException(SchemaException.Reason.LOAD_FAILED, "IO reading schema " + document + ": " + e.getMessage(), e);
    }
  }

  static URI stripFragment(URI uri) {
    String s = uri.toString();
    int i = s.indexOf('#');
    URI base = i >= 0 ? URI.create(s.substring(0, i)) : uri;
    return base.normalize();
  }
}
