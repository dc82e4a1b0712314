package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.Json;
import io.github.jsonvalidation.json.JsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonValidatorTest extends JsonSchemaTestBase {

    private JsonValidator validator;

    @BeforeEach
    void setUp() {
        validator = new JsonValidator(new DirectorySchemaLocator(schemaResources()));
    }

    @Test
    void validDocumentCarriesTheDecodedValue() {
        ValidationResult result = validator.validate("{\"id\": 7, \"roles\": [\"admin\"]}", "user.json");

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.value()).isInstanceOf(JsonValue.class);
        assertThat(((JsonValue) result.value()).get("id").toString()).isEqualTo("7");
    }

    @Test
    void untypedModeReturnsMapsAndLists() {
        ValidationResult result = validator.validate("{\"id\": 7, \"roles\": [\"admin\"]}", "user.json", DecodeMode.UNTYPED);

        assertThat(result.valid()).isTrue();
        assertThat(result.value()).isEqualTo(Map.of("id", 7L, "roles", List.of("admin")));
    }

    @Test
    void wrongTypeGivesOneErrorAtThePointer() {
        ValidationResult result = validator.validate("{\"id\": \"abc\"}", "user.json");

        assertThat(result.valid()).isFalse();
        assertThat(result.value()).isNull();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.pointer()).isEqualTo("/id");
            assertThat(e.constraint()).isEqualTo("type");
        });
    }

    @Test
    void everyViolationIsReported() {
        ValidationResult result = validator.validate("{\"roles\": [\"admin\", \"root\", \"admin\"]}", "user.json");

        assertThat(result.errors()).extracting(ValidationError::constraint)
                .containsExactly("required", "uniqueItems", "enum");
        assertThat(result.errors()).extracting(ValidationError::pointer)
                .containsExactly("/id", "/roles", "/roles/1");
    }

    @Test
    void missingSchemaIsReportedOnce() {
        ValidationResult result = validator.validate("{}", "missing.json");

        assertThat(result.valid()).isFalse();
        assertThat(result.value()).isNull();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.message()).isEqualTo("Unable to locate schema missing.json");
            assertThat(e.pointer()).isNull();
            assertThat(e.constraint()).isNull();
        });
    }

    @Test
    void schemaIdOutsideTheDirectoryIsNotLocated() {
        ValidationResult result = validator.validate("{}", "../../../../pom.xml");
        assertThat(result.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("Unable to locate schema"));
    }

    @Test
    void malformedInputGivesOneDecodeError() {
        ValidationResult result = validator.validate("{invalid", "user.json");

        assertThat(result.valid()).isFalse();
        assertThat(result.value()).isNull();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isNull();
            assertThat(e.message()).startsWith("[UNEXPECTED_CHARACTER] ");
            assertThat(e.message()).contains("line 1, column 2");
        });
    }

    @Test
    void oneOfWithTwoMatchingBranches() {
        ValidationResult result = validator.validate("5", "choice.json");

        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isEqualTo("oneOf");
            assertThat(e.message()).contains("more than one matched");
        });
        assertThat(validator.validate("5.5", "choice.json").valid()).isTrue();
    }

    @Test
    void emptyBodyMayBeValid() {
        ValidationResult empty = validator.validateBody("", "user.json", true);
        assertThat(empty.valid()).isTrue();
        assertThat(empty.value()).isNull();
        assertThat(empty.errors()).isEmpty();

        assertThat(validator.validateBody(null, "user.json", true).valid()).isTrue();

        ValidationResult rejected = validator.validateBody("", "user.json", false);
        assertThat(rejected.valid()).isFalse();
        assertThat(rejected.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("[EMPTY_DOCUMENT]"));

        assertThat(validator.validateBody("{\"id\":1}", "user.json", true).valid()).isTrue();
    }

    @Test
    void brokenSchemaDocumentIsOneCompileError() {
        ValidationResult result = validator.validate("{}", "broken.json");

        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isNull();
            assertThat(e.message()).contains("broken.json").contains("is not valid JSON");
        });
    }

    @Test
    void compileFailuresAreReportedAndNotCached() {
        ValidationResult cycle = validator.validate("{\"x\":1}", "cycle.json");
        assertThat(cycle.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("Cyclic $ref: "));

        ValidationResult dangling = validator.validate("{}", "dangling.json");
        assertThat(dangling.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("Unresolved $ref #/definitions/missing"));

        assertThat(validator.cachedSchemas()).isZero();
    }

    @Test
    void compiledSchemasAreCachedPerLocation() {
        validator.validate("{\"id\":1}", "user.json");
        validator.validate("{\"id\":2}", "./user.json");
        validator.validate("{\"value\":1}", "tree.json");

        assertThat(validator.cachedSchemas()).isEqualTo(2);
        assertThat(validator.compile("user.json")).isSameAs(validator.compile("user.json"));
    }

    @Test
    void cacheCanBeDisabled() {
        JsonValidator uncached = new JsonValidator(new DirectorySchemaLocator(schemaResources()),
                ValidatorOptions.defaults().withCacheSchemas(false));

        assertThat(uncached.validate("{\"id\":1}", "user.json").valid()).isTrue();
        assertThat(uncached.cachedSchemas()).isZero();
        assertThat(uncached.compile("user.json")).isNotSameAs(uncached.compile("user.json"));
    }

    @Test
    void formatAssertionFollowsTheOptions() {
        String json = "{\"id\":1,\"email\":\"nope\"}";
        assertThat(validator.validate(json, "user.json").valid()).isTrue();

        JsonValidator strict = new JsonValidator(new DirectorySchemaLocator(schemaResources()),
                ValidatorOptions.defaults().withAssertFormats(true));
        assertThat(strict.validate(json, "user.json").errors()).singleElement().satisfies(e -> {
            assertThat(e.pointer()).isEqualTo("/email");
            assertThat(e.constraint()).isEqualTo("format");
        });
    }

    @Test
    void oversizedSchemaIsRejected() {
        JsonValidator tiny = new JsonValidator(new DirectorySchemaLocator(schemaResources()),
                ValidatorOptions.defaults().withLoadPolicy(LoadPolicy.defaults().withMaxDocumentBytes(16)));

        assertThat(tiny.validate("{}", "user.json").errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("exceeds maxDocumentBytes"));
    }

    @Test
    void inMemorySchemas() {
        JsonValidator memory = new JsonValidator(SchemaLocator.inMemory(Map.of(
                "order", "{\"required\":[\"sku\"],\"properties\":{\"qty\":{\"$ref\":\"common#/definitions/qty\"}}}",
                "common", "{\"definitions\":{\"qty\":{\"type\":\"integer\",\"minimum\":1}}}")));

        assertThat(memory.validate("{\"sku\":\"A\",\"qty\":2}", "order").valid()).isTrue();
        assertThat(memory.validate("{\"sku\":\"A\",\"qty\":0}", "order").errors())
                .extracting(ValidationError::pointer).containsExactly("/qty");
        assertThat(memory.validate("{}", "nothing").errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).isEqualTo("Unable to locate schema nothing"));
    }

    @Test
    void exponentsBeyondDecimalRangeAreDecodeErrors() {
        JsonValidator memory = new JsonValidator(SchemaLocator.inMemory(Map.of(
                "integer", "{\"type\":\"integer\"}",
                "minimum", "{\"minimum\":0}",
                "enum", "{\"enum\":[1]}",
                "unique", "{\"uniqueItems\":true}",
                "any", "{}")));

        for (String id : List.of("integer", "minimum", "enum", "any")) {
            assertThat(memory.validate("1e9999999999", id).errors()).as(id).singleElement().satisfies(e -> {
                assertThat(e.constraint()).isNull();
                assertThat(e.message()).startsWith("[INVALID_NUMBER] Exponent out of range");
            });
        }
        assertThat(memory.validate("[1e9999999999,2]", "unique").errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("[INVALID_NUMBER]"));
        assertThat(memory.validate("1e9999999999", "any", DecodeMode.UNTYPED).valid()).isFalse();

        ValidationResult huge = memory.validate("1e2147483647", "integer", DecodeMode.UNTYPED);
        assertThat(huge.valid()).isTrue();
        assertThat(memory.validate("1e2147483647", "minimum").valid()).isTrue();
    }

    @Test
    void schemaKeywordWithExponentBeyondDecimalRangeIsOneCompileError() {
        JsonValidator memory = new JsonValidator(SchemaLocator.inMemory(Map.of(
                "bounded", "{\"minimum\":1e9999999999}")));

        ValidationResult result = memory.validate("5", "bounded");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.constraint()).isNull();
            assertThat(e.message()).contains("is not valid JSON").contains("[INVALID_NUMBER]");
        });
    }

    @Test
    void largeMinimumIsReportedWithoutExpandingTheExponent() {
        CompiledSchema schema = compile("{\"minimum\":1e2000000000}");

        assertThat(schema.validate(Json.parse("5"))).singleElement()
                .satisfies(e -> assertThat(e.message()).isEqualTo("Below minimum 1E+2000000000"));
    }

    @Test
    void compileThrowsForUnknownIdentifiers() {
        assertThatThrownBy(() -> validator.compile("missing.json"))
                .isInstanceOf(SchemaNotFoundException.class)
                .satisfies(e -> assertThat(((SchemaNotFoundException) e).identifier()).isEqualTo("missing.json"));
    }

    @Test
    void repeatedValidationIsDeterministic() {
        String json = "{\"roles\": [\"root\", \"root\"]}";
        ValidationResult first = validator.validate(json, "user.json");
        ValidationResult second = validator.validate(json, "user.json");

        assertThat(second).isEqualTo(first);
        assertThat(second.errors()).isNotSameAs(first.errors());
    }
}
