package com.eainde.xrf.agent;

import com.eainde.xrf.exception.AiResponseParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRepliesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("strips markdown fences")
    void fenced() {
        assertThat(JsonReplies.cleanJson("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(JsonReplies.cleanJson("```\n[1]\n```")).isEqualTo("[1]");
        assertThat(JsonReplies.cleanJson("  {\"a\": 1} ")).isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("finds JSON surrounded by chatter")
    void embedded() {
        JsonNode node = JsonReplies.readTree(mapper, "Sure! Here is the mapping: {\"mappings\": []} Hope this helps.");

        assertThat(node.has("mappings")).isTrue();
    }

    @Test
    @DisplayName("rejects replies without JSON")
    void invalid() {
        assertThatThrownBy(() -> JsonReplies.readTree(mapper, "I cannot help with that"))
                .isInstanceOf(AiResponseParseException.class)
                .hasMessageStartingWith("Reply is not valid JSON");
        assertThatThrownBy(() -> JsonReplies.readTree(mapper, "   "))
                .isInstanceOf(AiResponseParseException.class);
    }
}
