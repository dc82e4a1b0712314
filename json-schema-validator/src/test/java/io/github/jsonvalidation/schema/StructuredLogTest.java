package io.github.jsonvalidation.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest extends JsonSchemaTestBase {

    @Test
    void eventLinesQuoteValuesWithSpaces() {
        assertThat(StructuredLog.ev("validate", "schema", "user.json", "valid", false, "note", "two words"))
                .isEqualTo("event=validate schema=user.json valid=false note=\"two words\"");
    }

    @Test
    void nullKeysAreSkippedAndLongValuesTruncated() {
        String line = StructuredLog.ev("compile", null, "ignored", "uri", "x".repeat(300));
        assertThat(line).startsWith("event=compile uri=").endsWith("...").doesNotContain("ignored");
        assertThat(line).hasSize("event=compile uri=".length() + 256 + 3);
    }
}
