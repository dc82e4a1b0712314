package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaNumberKeywordsTest extends JsonSchemaTestBase {

    @Test
    void inclusiveBoundsAreHonored() {
        CompiledSchema schema = compile("{\"type\":\"number\",\"minimum\":0,\"maximum\":10}");

        assertThat(schema.validate(Json.parse("0"))).isEmpty();
        assertThat(schema.validate(Json.parse("10"))).isEmpty();
        assertThat(schema.validate(Json.parse("-0.5"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("minimum");
            assertThat(e.message()).isEqualTo("Below minimum 0");
        });
        assertThat(schema.validate(Json.parse("10.01"))).extracting(ValidationError::constraint)
                .containsExactly("maximum");
    }

    @Test
    void numericExclusiveBounds() {
        CompiledSchema schema = compile("{\"exclusiveMinimum\":0,\"exclusiveMaximum\":10}");

        assertThat(schema.validate(Json.parse("0"))).extracting(ValidationError::constraint)
                .containsExactly("exclusiveMinimum");
        assertThat(schema.validate(Json.parse("0.0"))).isNotEmpty();
        assertThat(schema.validate(Json.parse("0.0001"))).isEmpty();
        assertThat(schema.validate(Json.parse("10"))).extracting(ValidationError::constraint)
                .containsExactly("exclusiveMaximum");
    }

    @Test
    void booleanExclusiveBoundsInDraft4() {
        CompiledSchema schema = compile("""
                {
                  "$schema": "http://json-schema.org/draft-04/schema#",
                  "type": "number",
                  "minimum": 0,
                  "maximum": 10,
                  "exclusiveMinimum": true,
                  "exclusiveMaximum": true
                }
                """);

        assertThat(schema.draft()).isEqualTo(Draft.DRAFT_4);
        assertThat(schema.validate(Json.parse("0"))).extracting(ValidationError::constraint)
                .containsExactly("exclusiveMinimum");
        assertThat(schema.validate(Json.parse("10"))).extracting(ValidationError::constraint)
                .containsExactly("exclusiveMaximum");
        assertThat(schema.validate(Json.parse("5"))).isEmpty();
    }

    @Test
    void multipleOfForDecimals() {
        CompiledSchema schema = compile("{\"type\":\"number\",\"multipleOf\":0.1}");

        assertThat(schema.validate(Json.parse("0.3"))).isEmpty();
        assertThat(schema.validate(Json.parse("-1.2"))).isEmpty();
        assertThat(schema.validate(Json.parse("0.25"))).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("multipleOf");
            assertThat(e.message()).isEqualTo("Not multiple of 0.1");
        });
    }

    @Test
    void multipleOfWithHugeOperandsFallsBackToRatio() {
        assertThat(NumberSchema.isMultipleOf(new BigDecimal("1e300"), new BigDecimal("1e-5"))).isTrue();
        assertThat(NumberSchema.isMultipleOf(new BigDecimal("7.5e100"), new BigDecimal("2.5e100"))).isTrue();
        assertThat(NumberSchema.isMultipleOf(new BigDecimal("0"), new BigDecimal("0.7"))).isTrue();
        assertThat(NumberSchema.isMultipleOf(new BigDecimal("4.5"), new BigDecimal("1.5"))).isTrue();
        assertThat(NumberSchema.isMultipleOf(new BigDecimal("4.6"), new BigDecimal("1.5"))).isFalse();
    }

    @Test
    void numberKeywordsIgnoreOtherKinds() {
        CompiledSchema schema = compile("{\"minimum\":5}");
        assertThat(schema.validate(Json.parse("\"1\""))).isEmpty();
        assertThat(schema.validate(Json.parse("[1]"))).isEmpty();
    }

    @Test
    void nonPositiveMultipleOfIsMalformed() {
        assertThatThrownBy(() -> compile("{\"multipleOf\":0}"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("multipleOf must be greater than 0")
                .satisfies(e -> assertThat(((SchemaException) e).reason()).isEqualTo(SchemaException.Reason.MALFORMED));
    }
}
