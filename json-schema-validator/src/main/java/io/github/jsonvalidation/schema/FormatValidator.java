package io.github.jsonvalidation.schema;

/// Format validator interface for string format validation
sealed public interface FormatValidator permits Format {
  /// Test if the string value matches the format
  /// @param s the string to test
  /// @return true if the string matches the format, false otherwise
  boolean test(String s);

  /// {@return the `format` keyword value this validator checks}
  String keyword();
}
