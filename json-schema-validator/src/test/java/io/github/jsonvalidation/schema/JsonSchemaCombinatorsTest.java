package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaCombinatorsTest extends JsonSchemaTestBase {

    @Test
    void allOfAggregatesEveryBranchError() {
        CompiledSchema schema = compile("""
                {"allOf":[{"type":"string"},{"minLength":5},{"pattern":"^a"}]}
                """);

        assertThat(schema.validate(Json.parse("\"abcdef\""))).isEmpty();
        assertThat(schema.validate(Json.parse("\"xyz\""))).extracting(ValidationError::constraint)
                .containsExactly("minLength", "pattern");
    }

    @Test
    void anyOfReportsOneErrorWhenNoBranchPasses() {
        CompiledSchema schema = compile("{\"anyOf\":[{\"type\":\"string\"},{\"type\":\"number\"}]}");

        assertThat(schema.validate(Json.parse("1"))).isEmpty();
        assertThat(schema.validate(Json.parse("true"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("anyOf");
            assertThat(e.message()).isEqualTo("Does not match any of the 2 schemas in anyOf");
        });
    }

    @Test
    void oneOfDistinguishesNoneFromSeveral() {
        CompiledSchema schema = compile("""
                {"oneOf":[{"type":"integer"},{"minimum":2}]}
                """);

        assertThat(schema.validate(Json.parse("1"))).isEmpty();
        assertThat(schema.validate(Json.parse("2.5"))).isEmpty();
        assertThat(schema.validate(Json.parse("3"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("oneOf");
            assertThat(e.message()).contains("more than one matched");
        });
        assertThat(schema.validate(Json.parse("1.5"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("oneOf");
            assertThat(e.message()).contains("none matched");
        });
    }

    @Test
    void notRejectsMatchingValues() {
        CompiledSchema schema = compile("{\"not\":{\"type\":\"null\"}}");

        assertThat(schema.validate(Json.parse("0"))).isEmpty();
        assertThat(schema.validate(Json.parse("null"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("not");
            assertThat(e.message()).isEqualTo("Schema should not match");
        });
    }

    @Test
    void ifThenElseSelectsABranch() {
        CompiledSchema schema = compile("""
                {
                  "if": {"properties": {"kind": {"const": "card"}}, "required": ["kind"]},
                  "then": {"required": ["number"]},
                  "else": {"required": ["iban"]}
                }
                """);

        assertThat(schema.validate(Json.parse("{\"kind\":\"card\",\"number\":\"4111\"}"))).isEmpty();
        assertThat(schema.validate(Json.parse("{\"kind\":\"card\"}"))).extracting(ValidationError::pointer)
                .containsExactly("/number");
        assertThat(schema.validate(Json.parse("{\"kind\":\"bank\"}"))).extracting(ValidationError::pointer)
                .containsExactly("/iban");
    }

    @Test
    void conditionalsAreUnknownBeforeDraft7() {
        CompiledSchema schema = compile("""
                {"$schema":"http://json-schema.org/draft-06/schema#","if":{"type":"string"},"then":false}
                """);

        assertThat(schema.draft()).isEqualTo(Draft.DRAFT_6);
        assertThat(schema.validate(Json.parse("\"x\""))).isEmpty();
    }

    @Test
    void booleanSchemas() {
        assertThat(compile("true").validate(Json.parse("{\"any\":[1]}"))).isEmpty();
        assertThat(compile("false").validate(Json.parse("1"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("false");
            assertThat(e.message()).isEqualTo("No value is allowed here");
        });
        assertThat(compile("{\"properties\":{\"gone\":false}}").validate(Json.parse("{\"gone\":1}")))
                .extracting(ValidationError::pointer).containsExactly("/gone");
    }

    @Test
    void applicatorsRunEvenWhenTypeFails() {
        CompiledSchema schema = compile("{\"type\":\"string\",\"not\":{\"type\":\"number\"}}");

        assertThat(schema.validate(Json.parse("5"))).extracting(ValidationError::constraint)
                .containsExactly("type", "not");
    }
}
