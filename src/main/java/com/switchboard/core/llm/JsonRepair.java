package com.switchboard.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Second-chance parsing of model output that was meant to be a JSON object.
 * <p>
 * Used once after a strict parse fails. Markdown fences and surrounding prose
 * are cut away here; trailing commas and backslashes before characters that
 * are not JSON escapes are left to a lenient Jackson mapper. Such a backslash
 * is dropped, so {@code "\d"} reads as {@code "d"}.
 */
public final class JsonRepair {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private JsonRepair() {}

    /**
     * @throws JsonProcessingException when the cleaned text is still not JSON
     * @throws IllegalArgumentException when there is no output at all
     */
    public static JsonNode readTree(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("model returned no output");
        }
        return LENIENT_MAPPER.readTree(repair(raw));
    }

    public static String repair(String raw) {
        if (raw == null) {
            return null;
        }
        return extractOutermostObject(stripCodeFences(raw.trim()));
    }

    static String stripCodeFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline >= 0 ? cleaned.substring(firstNewline + 1) : cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    static String extractOutermostObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return text;
        }
        return text.substring(start, end + 1);
    }
}
