package io.github.jsonvalidation.schema;

/// Guardrails on how much the compiler may load for one root schema
///
/// @param maxDocumentBytes largest schema document accepted, in UTF-8 bytes
/// @param maxDocuments most documents one compilation may load, the root included
public record LoadPolicy(long maxDocumentBytes, int maxDocuments) {

  public LoadPolicy {
    if (maxDocumentBytes <= 0L) {
      throw new IllegalArgumentException("maxDocumentBytes must be > 0");
    }
    if (maxDocuments <= 0) {
      throw new IllegalArgumentException("maxDocuments must be > 0");
    }
  }

  public static LoadPolicy defaults() {
    return new LoadPolicy(1_048_576L, 64);
  }

  public LoadPolicy withMaxDocumentBytes(long bytes) {
    return new LoadPolicy(bytes, maxDocuments);
  }

  public LoadPolicy withMaxDocuments(int documents) {
    return new LoadPolicy(maxDocumentBytes, documents);
  }
}
