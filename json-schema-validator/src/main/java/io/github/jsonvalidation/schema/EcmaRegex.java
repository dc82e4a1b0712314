package io.github.jsonvalidation.schema;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Translates ECMA-262 regular expressions, the dialect JSON Schema patterns are
/// written in, into `java.util.regex` syntax.
///
/// Only the constructs whose meaning differs are rewritten:
/// - `$` outside a character class matches at the end of input only (`\z`)
/// - `[^]` matches any character, `[]` matches nothing
/// - `[` and `&` inside a character class are literals
final class EcmaRegex {

  /// {@return `pattern` rewritten for `java.util.regex`}
  static String translate(String pattern) {
    StringBuilder out = new StringBuilder(pattern.length() + 8);
    boolean inClass = false;
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '\\') {
        // Copy an escape pair untouched
        out.append(c);
        if (i + 1 < pattern.length()) {
          out.append(pattern.charAt(i + 1));
        }
        i += 2;
        continue;
      }
      if (inClass) {
        if (c == ']') {
          inClass = false;
          out.append(c);
        } else if (c == '[' || c == '&') {
          out.append('\\').append(c);
        } else {
          out.append(c);
        }
        i++;
        continue;
      }
      if (c == '[') {
        if (pattern.startsWith("[^]", i)) {
          out.append("[\\s\\S]");
          i += 3;
          continue;
        }
        if (pattern.startsWith("[]", i)) {
          out.append("(?!)");
          i += 2;
          continue;
        }
        inClass = true;
        out.append(c);
        i++;
        if (i < pattern.length() && pattern.charAt(i) == '^') {
          out.append('^');
          i++;
        }
        continue;
      }
      if (c == '$') {
        out.append("\\z");
      } else {
        out.append(c);
      }
      i++;
    }
    return out.toString();
  }

  /// Compiles an ECMA-262 pattern.
  ///
  /// @throws SchemaException with `INVALID_PATTERN` when the pattern is not usable
  static Pattern compile(String pattern, String location) {
    try {
      return Pattern.compile(translate(pattern));
    } catch (PatternSyntaxException e) {
      SchemaLogging.LOG.severe(() -> "ERROR: PATTERN: invalid pattern at " + location + ": " + pattern);
      throw new SchemaException(SchemaException.Reason.INVALID_PATTERN,
          "Invalid pattern at " + location + ": " + pattern + " (" + e.getDescription() + ")", e);
    }
  }

  private EcmaRegex() {}
}
