package io.github.jsonvalidation.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonPointerTest extends JsonSchemaTestBase {

    @Test
    void childrenBuildPointerAndPropertyPath() {
        JsonPointer at = JsonPointer.ROOT.child("user").child("tags").child(0);

        assertThat(at.pointer()).isEqualTo("/user/tags/0");
        assertThat(at.property()).isEqualTo("user.tags[0]");
        assertThat(at).hasToString("/user/tags/0");
        assertThat(JsonPointer.ROOT.pointer()).isEmpty();
        assertThat(JsonPointer.ROOT.child(2).property()).isEqualTo("[2]");
    }

    @Test
    void escapingFollowsRfc6901() {
        assertThat(JsonPointer.escape("a/b~c")).isEqualTo("a~1b~0c");
        assertThat(JsonPointer.unescape("a~1b~0c")).isEqualTo("a/b~c");
        assertThat(JsonPointer.unescape("~01")).isEqualTo("~1");
        assertThat(JsonPointer.ROOT.child("").pointer()).isEqualTo("/");
    }
}
