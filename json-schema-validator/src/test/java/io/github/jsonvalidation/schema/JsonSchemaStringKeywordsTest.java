package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaStringKeywordsTest extends JsonSchemaTestBase {

    @Test
    void lengthsCountCodePoints() {
        CompiledSchema schema = compile("{\"type\":\"string\",\"minLength\":2,\"maxLength\":3}");

        assertThat(schema.validate(Json.parse("\"ab\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"\\uD83D\\uDE00\\uD83D\\uDE00\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"\\uD83D\\uDE00\""))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("minLength");
            assertThat(e.message()).isEqualTo("String too short: expected at least 2 characters");
        });
        assertThat(schema.validate(Json.parse("\"abcd\""))).extracting(ValidationError::constraint)
                .containsExactly("maxLength");
    }

    @Test
    void patternIsUnanchored() {
        CompiledSchema schema = compile("{\"pattern\":\"[0-9]{3}\"}");

        assertThat(schema.validate(Json.parse("\"abc123def\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"12\""))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("pattern");
            assertThat(e.message()).isEqualTo("Pattern mismatch: [0-9]{3}");
        });
    }

    @Test
    void dollarAnchorsAtEndOfInputOnly() {
        CompiledSchema schema = compile("{\"pattern\":\"^abc$\"}");

        assertThat(schema.validate(Json.parse("\"abc\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"abc\\n\""))).extracting(ValidationError::constraint)
                .containsExactly("pattern");
    }

    @Test
    void invalidPatternFailsCompilation() {
        assertThatThrownBy(() -> compile("{\"pattern\":\"(unclosed\"}"))
                .isInstanceOf(SchemaException.class)
                .satisfies(e -> assertThat(((SchemaException) e).reason()).isEqualTo(SchemaException.Reason.INVALID_PATTERN))
                .hasMessageContaining("(unclosed");
    }

    @Test
    void formatIsAnnotationByDefault() {
        CompiledSchema schema = compile("{\"type\":\"string\",\"format\":\"email\"}");
        assertThat(schema.validate(Json.parse("\"not-an-email\""))).isEmpty();
    }

    @Test
    void formatIsAssertedWhenEnabled() {
        CompiledSchema schema = compile("{\"type\":\"string\",\"format\":\"email\"}",
                ValidatorOptions.defaults().withAssertFormats(true));

        assertThat(schema.validate(Json.parse("\"a@example.com\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"not-an-email\""))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("format");
            assertThat(e.message()).isEqualTo("Invalid format 'email'");
        });
    }

    @Test
    void rootFlagEnablesFormatAssertion() {
        CompiledSchema schema = compile("{\"formatAssertion\":true,\"format\":\"ipv4\"}");

        assertThat(schema.validate(Json.parse("\"192.168.0.1\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"999.1.1.1\""))).extracting(ValidationError::constraint)
                .containsExactly("format");
    }

    @Test
    void unknownFormatIsIgnoredEvenWhenAsserting() {
        CompiledSchema schema = compile("{\"format\":\"credit-card\"}", ValidatorOptions.defaults().withAssertFormats(true));
        assertThat(schema.validate(Json.parse("\"whatever\""))).isEmpty();
    }

    @Test
    void stringKeywordsIgnoreOtherKinds() {
        CompiledSchema schema = compile("{\"minLength\":10,\"pattern\":\"^x\"}");
        assertThat(schema.validate(Json.parse("12"))).isEmpty();
    }
}
