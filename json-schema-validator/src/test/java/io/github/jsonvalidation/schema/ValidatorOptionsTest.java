package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorOptionsTest extends JsonSchemaTestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY);
        System.clearProperty(ValidatorOptions.CACHE_PROPERTY);
        System.clearProperty(ValidatorOptions.DRAFT_PROPERTY);
    }

    @Test
    void defaults() {
        ValidatorOptions options = ValidatorOptions.defaults();

        assertThat(options.assertFormats()).isFalse();
        assertThat(options.cacheSchemas()).isTrue();
        assertThat(options.defaultDraft()).isEqualTo(Draft.DRAFT_7);
        assertThat(options.loadPolicy()).isEqualTo(LoadPolicy.defaults());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(ValidatorOptions.FORMAT_ASSERTION_PROPERTY, "true");
        System.setProperty(ValidatorOptions.CACHE_PROPERTY, "false");
        System.setProperty(ValidatorOptions.DRAFT_PROPERTY, "draft-04");

        ValidatorOptions options = ValidatorOptions.fromSystemProperties();

        assertThat(options.assertFormats()).isTrue();
        assertThat(options.cacheSchemas()).isFalse();
        assertThat(options.defaultDraft()).isEqualTo(Draft.DRAFT_4);
    }

    @Test
    void draftNamesParseLeniently() {
        assertThat(Draft.parse("draft-06")).isEqualTo(Draft.DRAFT_6);
        assertThat(Draft.parse("7")).isEqualTo(Draft.DRAFT_7);
        assertThat(Draft.parse("DRAFT_4")).isEqualTo(Draft.DRAFT_4);
        assertThatThrownBy(() -> Draft.parse("2020-12")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultDraftAppliesWithoutSchemaKeyword() {
        CompiledSchema schema = compile("{\"const\":1}", ValidatorOptions.defaults().withDefaultDraft(Draft.DRAFT_4));

        assertThat(schema.draft()).isEqualTo(Draft.DRAFT_4);
        assertThat(schema.validate(Json.parse("2"))).isEmpty();
    }
}
