package com.openforge.memgraph.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.error.MalformedResponseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void extractsObjectFromFencedBlock() {
        JsonNode node = LlmJson.parse(mapper, "Sure!\n```json\n{\"keys\": [\"a\"]}\n```\nAnything else?");

        assertThat(LlmJson.stringList(node, "keys", true)).containsExactly("a");
    }

    @Test
    void extractsObjectSurroundedByProse() {
        JsonNode node = LlmJson.parse(mapper, "The answer is {\"relation\": \"CAUSE\"} as requested.");

        assertThat(LlmJson.requireText(node, "relation")).isEqualTo("CAUSE");
    }

    @Test
    void bareStringCountsAsOneElementList() {
        JsonNode node = LlmJson.parse(mapper, "{\"tags\": \"travel\"}");

        assertThat(LlmJson.stringList(node, "tags", false)).containsExactly("travel");
        assertThat(LlmJson.stringList(node, "missing", false)).isEmpty();
    }

    @Test
    void rejectsBrokenOrMissingDocuments() {
        assertThatThrownBy(() -> LlmJson.parse(mapper, "no json here"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> LlmJson.parse(mapper, "{\"keys\": [\"a\",}"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> LlmJson.parse(mapper, "   "))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void validatesFieldShapes() {
        JsonNode node = LlmJson.parse(mapper, "{\"keys\": [1, 2], \"confidence\": 1.5, \"summary\": \"\"}");

        assertThatThrownBy(() -> LlmJson.stringList(node, "keys", false))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("keys");
        assertThatThrownBy(() -> LlmJson.probability(node, "confidence", 1.0))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> LlmJson.requireText(node, "summary"))
                .isInstanceOf(MalformedResponseException.class);
        assertThat(LlmJson.probability(node, "absent", 0.4)).isEqualTo(0.4);
    }
}
