package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

import java.util.Objects;

/// Identity of one frame, used to detect and break validation cycles.
/// Schema and instance compare by identity, the pointer by value.
record ValidationKey(JsonSchema schema, JsonValue json, String pointer) {

  static ValidationKey of(ValidationFrame frame) {
    return new ValidationKey(frame.schema(), frame.json(), frame.at().pointer());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ValidationKey)) {
      return false;
    }
    ValidationKey other = (ValidationKey) obj;
    return this.schema == other.schema
        && this.json == other.json
        && Objects.equals(this.pointer, other.pointer);
  }

  @Override
  public int hashCode() {
    int result = System.identityHashCode(schema);
    result = 31 * result + System.identityHashCode(json);
    result = 31 * result + (pointer != null ? pointer.hashCode() : 0);
    return result;
  }
}
