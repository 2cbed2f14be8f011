package com.courier.normalization.parsers;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonMessageParser Tests")
class JsonMessageParserTest {

    private final JsonMessageParser parser = new JsonMessageParser();

    @Test
    @DisplayName("Should return top-level fields as Java values")
    void shouldReturnTopLevelFields() {
        Map<String, Object> result = parser.parse(" {\"user\":\"alice\",\"count\":3,\"ok\":true,\"tags\":[\"a\"],\"none\":null} ");

        assertThat(result).containsEntry("user", "alice")
            .containsEntry("count", 3)
            .containsEntry("ok", true)
            .containsEntry("tags", "[\"a\"]")
            .containsEntry("none", null);
        assertThat(result.keySet()).containsExactly("user", "count", "ok", "tags", "none");
    }

    @Test
    @DisplayName("Should return null for non-object or broken JSON")
    void shouldReturnNullForOtherInput() {
        assertThat(parser.parse("[1,2]")).isNull();
        assertThat(parser.parse("{not json}")).isNull();
        assertThat(parser.parse("plain text")).isNull();
        assertThat(parser.parse(null)).isNull();
    }
}
