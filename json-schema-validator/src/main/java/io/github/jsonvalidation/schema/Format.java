package io.github.jsonvalidation.schema;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Built-in format validators.
///
/// Dates and times follow RFC 3339: a time zone offset is mandatory for
/// `date-time` and `time`, and `T`/`Z` may be lower case.
public enum Format implements FormatValidator {
  DATE_TIME {
    @Override
    public boolean test(String s) {
      try {
        OffsetDateTime.parse(s.toUpperCase(Locale.ROOT));
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  },

  DATE {
    @Override
    public boolean test(String s) {
      if (!FULL_DATE.matcher(s).matches()) return false;
      try {
        LocalDate.parse(s);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  },

  TIME {
    @Override
    public boolean test(String s) {
      try {
        OffsetTime.parse(s.toUpperCase(Locale.ROOT));
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  },

  EMAIL {
    @Override
    public boolean test(String s) {
      // Pragmatic RFC-5322-lite: no whitespace, one @, no leading/trailing/consecutive dots in the local part
      int at = s.lastIndexOf('@');
      if (at <= 0 || at == s.length() - 1 || s.indexOf('@') != at) return false;
      String local = s.substring(0, at);
      if (local.startsWith(".") || local.endsWith(".") || local.contains("..")) return false;
      return !s.chars().anyMatch(Character::isWhitespace) && HOSTNAME.test(s.substring(at + 1));
    }
  },

  HOSTNAME {
    @Override
    public boolean test(String s) {
      // Labels a-zA-Z0-9-, no leading/trailing -, label 1-63, total <= 253
      String host = s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
      if (host.isEmpty() || host.length() > 253) return false;
      for (String label : host.split("\\.", -1)) {
        if (label.isEmpty() || label.length() > 63) return false;
        if (label.startsWith("-") || label.endsWith("-")) return false;
        if (!HOSTNAME_LABEL.matcher(label).matches()) return false;
      }
      return true;
    }
  },

  IPV4 {
    @Override
    public boolean test(String s) {
      String[] parts = s.split("\\.", -1);
      if (parts.length != 4) return false;
      for (String part : parts) {
        if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(c -> c >= '0' && c <= '9')) return false;
        // No leading zeros except for 0 itself
        if (part.length() > 1 && part.startsWith("0")) return false;
        if (Integer.parseInt(part) > 255) return false;
      }
      return true;
    }
  },

  IPV6 {
    @Override
    public boolean test(String s) {
      int lastColon = s.lastIndexOf(':');
      if (lastColon < 0) return false;
      String work = s;
      String tail = s.substring(lastColon + 1);
      if (tail.contains(".")) {
        // An embedded IPv4 address stands in for the last two groups
        if (!IPV4.test(tail)) return false;
        work = s.substring(0, lastColon + 1) + "0:0";
      }
      int compressed = work.indexOf("::");
      if (compressed < 0) {
        String[] groups = work.split(":", -1);
        return groups.length == 8 && allHexGroups(groups);
      }
      if (work.indexOf("::", compressed + 1) >= 0) return false;
      String left = work.substring(0, compressed);
      String right = work.substring(compressed + 2);
      String[] leftGroups = left.isEmpty() ? new String[0] : left.split(":", -1);
      String[] rightGroups = right.isEmpty() ? new String[0] : right.split(":", -1);
      return allHexGroups(leftGroups) && allHexGroups(rightGroups)
          && leftGroups.length + rightGroups.length <= 7;
    }
  },

  URI {
    @Override
    public boolean test(String s) {
      try {
        java.net.URI uri = new java.net.URI(s);
        return uri.isAbsolute();
      } catch (java.net.URISyntaxException e) {
        return false;
      }
    }
  },

  URI_REFERENCE {
    @Override
    public boolean test(String s) {
      try {
        new java.net.URI(s);
        return true;
      } catch (java.net.URISyntaxException e) {
        return false;
      }
    }
  },

  UUID {
    @Override
    public boolean test(String s) {
      return UUID_TEXT.matcher(s).matches();
    }
  },

  REGEX {
    @Override
    public boolean test(String s) {
      try {
        Pattern.compile(EcmaRegex.translate(s));
        return true;
      } catch (PatternSyntaxException e) {
        return false;
      }
    }
  },

  JSON_POINTER {
    @Override
    public boolean test(String s) {
      if (s.isEmpty()) return true;
      if (!s.startsWith("/")) return false;
      for (int i = 0; i < s.length(); i++) {
        if (s.charAt(i) == '~') {
          if (i + 1 >= s.length()) return false;
          char next = s.charAt(i + 1);
          if (next != '0' && next != '1') return false;
        }
      }
      return true;
    }
  };

  private static final String HEX_DIGITS = "0123456789abcdefABCDEF";
  private static final Pattern FULL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern HOSTNAME_LABEL = Pattern.compile("[a-zA-Z0-9-]+");
  private static final Pattern UUID_TEXT =
      Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private static boolean allHexGroups(String[] groups) {
    for (String g : groups) {
      if (g.isEmpty() || g.length() > 4) return false;
      for (int i = 0; i < g.length(); i++) {
        if (HEX_DIGITS.indexOf(g.charAt(i)) < 0) return false;
      }
    }
    return true;
  }

  @Override
  public String keyword() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  /// Get format validator by keyword value (case-insensitive), or `null` if unknown
  static FormatValidator byName(String name) {
    try {
      return Format.valueOf(name.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
