package io.github.jsonvalidation.schema;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static io.github.jsonvalidation.schema.SchemaLogging.LOG;

/// Locates schemas as files under a root directory that acts as a jail:
/// neither identifiers nor `$ref`s may reach files outside it.
public record DirectorySchemaLocator(Path root) implements SchemaLocator {

  public DirectorySchemaLocator(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    LOG.fine(() -> "DirectorySchemaLocator root=" + this.root);
  }

  @Override
  public URI locate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    Path target;
    try {
      target = root.resolve(identifier).normalize();
    } catch (InvalidPathException e) {
      throw new SchemaNotFoundException(identifier, "Unable to locate schema " + identifier, e);
    }
    if (!target.startsWith(root)) {
      LOG.fine(() -> "LOCATE DENIED outside root: id=" + identifier + " path=" + target + " root=" + root);
      throw new SchemaNotFoundException(identifier);
    }
    if (!Files.isRegularFile(target)) {
      LOG.finer(() -> "NOT_FOUND: " + target);
      throw new SchemaNotFoundException(identifier);
    }
    return target.toUri();
  }

  @Override
  public Optional<String> content(URI location) {
    if (!"file".equalsIgnoreCase(location.getScheme())) {
      return Optional.empty();
    }
    Path target = Path.of(SchemaLoader.stripFragment(location)).normalize();
    if (!target.startsWith(root)) {
      LOG.fine(() -> "READ DENIED outside root: path=" + target + " root=" + root);
      throw new SchemaNotFoundException(location.toString(), "Outside schema root: " + location, null);
    }
    if (!Files.isRegularFile(target)) {
      throw new SchemaNotFoundException(location.toString());
    }
    try {
      return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
    } catch (IOException e) {
      LOG.severe(() -> "ERROR: IO reading schema " + target + ": " + e.getMessage());
      throw new SchemaException(SchemaException.Reason.LOAD_FAILED, "IO reading schema " + location + ": " + e.getMessage(), e);
    }
  }
}
