package io.github.jsonvalidation.schema;

/// Shape of the decoded value a successful validation returns.
public enum DecodeMode {
  /// The `JsonValue` tree that was validated
  TYPED,
  /// Plain `Map`/`List`/`String`/`Number`/`Boolean`/`null`, obtained by decoding
  /// the input a second time. Costs a second parse and is only done when asked for.
  UNTYPED
}
