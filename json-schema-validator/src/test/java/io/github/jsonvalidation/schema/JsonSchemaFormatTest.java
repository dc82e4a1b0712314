package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaFormatTest extends JsonSchemaTestBase {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY);
    }

    static Stream<Arguments> samples() {
        return Stream.of(
                Arguments.of(Format.DATE_TIME, "2024-02-29T10:15:30Z", true),
                Arguments.of(Format.DATE_TIME, "2024-02-29t10:15:30.5+01:00", true),
                Arguments.of(Format.DATE_TIME, "2024-02-29 10:15:30", false),
                Arguments.of(Format.DATE, "2024-02-29", true),
                Arguments.of(Format.DATE, "2023-02-29", false),
                Arguments.of(Format.DATE, "2024-2-9", false),
                Arguments.of(Format.TIME, "10:15:30+02:00", true),
                Arguments.of(Format.TIME, "25:00:00Z", false),
                Arguments.of(Format.EMAIL, "first.last@example.com", true),
                Arguments.of(Format.EMAIL, "first..last@example.com", false),
                Arguments.of(Format.EMAIL, "a@b@example.com", false),
                Arguments.of(Format.EMAIL, "no-at-sign", false),
                Arguments.of(Format.HOSTNAME, "api.example-host.com", true),
                Arguments.of(Format.HOSTNAME, "-bad.example.com", false),
                Arguments.of(Format.HOSTNAME, "a".repeat(64) + ".com", false),
                Arguments.of(Format.IPV4, "192.168.0.1", true),
                Arguments.of(Format.IPV4, "256.1.1.1", false),
                Arguments.of(Format.IPV4, "01.1.1.1", false),
                Arguments.of(Format.IPV4, "1.1.1", false),
                Arguments.of(Format.IPV6, "2001:db8::1", true),
                Arguments.of(Format.IPV6, "::", true),
                Arguments.of(Format.IPV6, "::ffff:192.168.0.1", true),
                Arguments.of(Format.IPV6, "1:2:3:4:5:6:7:8", true),
                Arguments.of(Format.IPV6, "1:2:3:4:5:6:7:8:9", false),
                Arguments.of(Format.IPV6, "1::2::3", false),
                Arguments.of(Format.IPV6, "12345::", false),
                Arguments.of(Format.URI, "https://example.com/a?b=c#d", true),
                Arguments.of(Format.URI, "/relative/path", false),
                Arguments.of(Format.URI_REFERENCE, "/relative/path", true),
                Arguments.of(Format.URI_REFERENCE, "bad uri with spaces", false),
                Arguments.of(Format.UUID, "123e4567-e89b-12d3-a456-426614174000", true),
                Arguments.of(Format.UUID, "123e4567e89b12d3a456426614174000", false),
                Arguments.of(Format.REGEX, "^[a-z]+$", true),
                Arguments.of(Format.REGEX, "(", false),
                Arguments.of(Format.JSON_POINTER, "/a~1b/0", true),
                Arguments.of(Format.JSON_POINTER, "", true),
                Arguments.of(Format.JSON_POINTER, "a/b", false),
                Arguments.of(Format.JSON_POINTER, "/a~2", false)
        );
    }

    @ParameterizedTest(name = "{0} \"{1}\" -> {2}")
    @MethodSource("samples")
    void formatValidators(Format format, String value, boolean expected) {
        assertThat(format.test(value)).isEqualTo(expected);
    }

    @Test
    void keywordsMatchSchemaNames() {
        assertThat(Format.DATE_TIME.keyword()).isEqualTo("date-time");
        assertThat(Format.JSON_POINTER.keyword()).isEqualTo("json-pointer");
        assertThat(Format.byName("uri-reference")).isEqualTo(Format.URI_REFERENCE);
        assertThat(Format.byName("IPv4")).isEqualTo(Format.IPV4);
        assertThat(Format.byName("phone")).isNull();
    }

    @Test
    void systemPropertyOverridesTheOptions() {
        System.setProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY, "true");
        CompiledSchema schema = compile("{\"format\":\"uuid\"}");

        assertThat(schema.validate(Json.parse("\"not-a-uuid\""))).extracting(ValidationError::constraint)
                .containsExactly("format");
    }

    @Test
    void rootFlagBeatsTheSystemProperty() {
        System.setProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY, "true");
        CompiledSchema schema = compile("{\"formatAssertion\":false,\"format\":\"uuid\"}");

        assertThat(schema.validate(Json.parse("\"not-a-uuid\""))).isEmpty();
    }

    @Test
    void formatOnlyAppliesToStrings() {
        CompiledSchema schema = compile("{\"format\":\"ipv4\"}", ValidatorOptions.defaults().withAssertFormats(true));
        assertThat(schema.validate(Json.parse("12"))).isEmpty();
    }
}
