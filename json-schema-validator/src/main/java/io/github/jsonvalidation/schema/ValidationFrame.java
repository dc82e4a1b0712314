package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonValue;

/// Unit of work on the validation stack: apply `schema` to `json` found at `at`
record ValidationFrame(JsonPointer at, JsonSchema schema, JsonValue json) {
}
