package io.github.jsonvalidation.schema;

import java.util.Objects;

/// Location of a node within the instance being validated.
///
/// Carries both the RFC 6901 pointer (`/user/tags/0`) and the dotted property
/// path (`user.tags[0]`) so that errors can report either form.
///
/// @param pointer RFC 6901 pointer; the document root is the empty string
/// @param property dotted/indexed property path; the document root is the empty string
public record JsonPointer(String pointer, String property) {

  /// The document root
  public static final JsonPointer ROOT = new JsonPointer("", "");

  public JsonPointer {
    Objects.requireNonNull(pointer, "pointer");
    Objects.requireNonNull(property, "property");
  }

  /// {@return the location of the named member of the object at this location}
  public JsonPointer child(String name) {
    return new JsonPointer(pointer + "/" + escape(name),
        property.isEmpty() ? name : property + "." + name);
  }

  /// {@return the location of the element at `index` of the array at this location}
  public JsonPointer child(int index) {
    return new JsonPointer(pointer + "/" + index, property + "[" + index + "]");
  }

  /// Escapes one reference token: `~` becomes `~0` and `/` becomes `~1`.
  public static String escape(String token) {
    if (token.indexOf('~') < 0 && token.indexOf('/') < 0) {
      return token;
    }
    return token.replace("~", "~0").replace("/", "~1");
  }

  /// Reverses {@link #escape(String)}. `~1` is replaced before `~0` so `~01` stays `~1`.
  public static String unescape(String token) {
    if (token.indexOf('~') < 0) {
      return token;
    }
    return token.replace("~1", "/").replace("~0", "~");
  }

  @Override
  public String toString() {
    return pointer;
  }
}
