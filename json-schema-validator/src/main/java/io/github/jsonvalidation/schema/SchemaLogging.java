package io.github.jsonvalidation.schema;

import java.util.logging.Logger;

/// Centralized logger for the schema validator.
/// All classes use this logger via:
///   import static io.github.jsonvalidation.schema.SchemaLogging.LOG;
final class SchemaLogging {
  static final Logger LOG = Logger.getLogger("io.github.jsonvalidation.schema");
  private SchemaLogging() {}
}
