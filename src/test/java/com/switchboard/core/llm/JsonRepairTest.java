package com.switchboard.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonRepairTest {

    @Nested
    @DisplayName("repair")
    class RepairTests {

        @Test
        @DisplayName("strips markdown code fences")
        void stripsCodeFences() {
            String raw = "```json\n{\"a\": 1}\n```";
            assertEquals("{\"a\": 1}", JsonRepair.repair(raw));
        }

        @Test
        @DisplayName("extracts the object from surrounding prose")
        void extractsOutermostObject() {
            String raw = "Sure! Here it is: {\"a\": {\"b\": 2}} Hope that helps.";
            assertEquals("{\"a\": {\"b\": 2}}", JsonRepair.repair(raw));
        }

        @Test
        @DisplayName("null stays null and text without an object is returned as is")
        void passThrough() {
            assertNull(JsonRepair.repair(null));
            assertEquals("no json here", JsonRepair.repair("no json here"));
        }
    }

    @Nested
    @DisplayName("readTree")
    class ReadTreeTests {

        @Test
        @DisplayName("accepts trailing commas but leaves commas inside strings")
        void trailingCommas() throws Exception {
            JsonNode node = JsonRepair.readTree("{\"list\": [1, 2, ], \"text\": \"a, }\", }");

            assertEquals(2, node.get("list").size());
            assertEquals("a, }", node.get("text").asText());
        }

        @Test
        @DisplayName("a backslash before a non-escape character is dropped, valid escapes are kept")
        void invalidEscapes() throws Exception {
            JsonNode node = JsonRepair.readTree("{\"reasoning\": \"matches \\d+\", \"ok\": \"a\\nb\"}");

            assertEquals("matches d+", node.get("reasoning").asText());
            assertEquals("a\nb", node.get("ok").asText());
        }

        @Test
        @DisplayName("cleans fences and prose before the lenient parse")
        void fencedWithProse() throws Exception {
            JsonNode node = JsonRepair.readTree("Here you go:\n```json\n{\"kind\": \"response\",}\n```");

            assertEquals("response", node.get("kind").asText());
        }

        @Test
        @DisplayName("text that is still not JSON fails, no output is refused")
        void failures() {
            assertThrows(JsonProcessingException.class, () -> JsonRepair.readTree("{\"a\": }"));
            assertThrows(IllegalArgumentException.class, () -> JsonRepair.readTree("  "));
            assertThrows(IllegalArgumentException.class, () -> JsonRepair.readTree(null));
        }
    }
}
