package io.github.jsonvalidation.schema;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Maps schema identifiers to locations. Supplied by the embedding application.
///
/// The validator never interprets identifiers itself; it asks the locator and
/// reports any failure as a single "Unable to locate schema" error.
public interface SchemaLocator {

  /// {@return the location of the schema named by `identifier`}
  ///
  /// @throws SchemaNotFoundException if the identifier cannot be located
  URI locate(String identifier);

  /// {@return the content at `location` if this locator serves it directly}
  /// The default serves nothing, leaving `file:` and `classpath:` locations to
  /// {@link SchemaLoader}.
  ///
  /// @throws SchemaNotFoundException if this locator owns `location` but has no content for it
  default Optional<String> content(URI location) {
    return Optional.empty();
  }

  /// Locator over schema texts held in memory, keyed by identifier.
  ///
  /// Identifiers become `mem:/` locations so that relative `$ref`s between
  /// the documents resolve as they would between files in one directory.
  static SchemaLocator inMemory(Map<String, String> schemas) {
    return new InMemory(schemas);
  }

  /// In-memory locator backing {@link #inMemory(Map)}
  final class InMemory implements SchemaLocator {
    static final String SCHEME = "mem";

    private final Map<URI, String> byLocation = new LinkedHashMap<>();

    InMemory(Map<String, String> schemas) {
      Objects.requireNonNull(schemas, "schemas");
      schemas.forEach((id, text) -> byLocation.put(toLocation(id), Objects.requireNonNull(text, id)));
    }

    @Override
    public URI locate(String identifier) {
      Objects.requireNonNull(identifier, "identifier");
      URI location;
      try {
        location = toLocation(identifier);
      } catch (IllegalArgumentException e) {
        throw new SchemaNotFoundException(identifier, "Unable to locate schema " + identifier, e);
      }
      if (!byLocation.containsKey(location)) {
        throw new SchemaNotFoundException(identifier);
      }
      return location;
    }

    @Override
    public Optional<String> content(URI location) {
      if (!SCHEME.equals(location.getScheme())) {
        return Optional.empty();
      }
      String text = byLocation.get(withoutFragment(location));
      if (text == null) {
        throw new SchemaNotFoundException(location.toString());
      }
      return Optional.of(text);
    }

    private static URI toLocation(String identifier) {
      String path = identifier.startsWith("/") ? identifier : "/" + identifier;
      return URI.create(SCHEME + ":" + path).normalize();
    }

    private static URI withoutFragment(URI uri) {
      String s = uri.toString();
      int i = s.indexOf('#');
      return i >= 0 ? URI.create(s.substring(0, i)) : uri;
    }
  }
}
