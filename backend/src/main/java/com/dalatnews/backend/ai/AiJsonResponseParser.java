package com.dalatnews.backend.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the JSON object out of a model reply that may be wrapped in markdown fences or
 * surrounded by prose.
 */
public final class AiJsonResponseParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private AiJsonResponseParser() {
    }

    /**
     * @throws AiResponseException when no JSON object can be read from {@code text}
     */
    public static JsonNode parseObject(String text) {
        if (text == null) {
            throw new AiResponseException("No text to parse");
        }
        String jsonText = stripFences(text);

        JsonNode node = tryRead(jsonText);
        if (node != null && node.isObject()) {
            return node;
        }

        String balanced = extractBalancedObject(jsonText);
        if (balanced != null) {
            node = tryRead(balanced);
            if (node != null && node.isObject()) {
                return node;
            }
        }

        int first = jsonText.indexOf('{');
        int last = jsonText.lastIndexOf('}');
        if (first >= 0 && last > first) {
            node = tryRead(jsonText.substring(first, last + 1));
            if (node != null && node.isObject()) {
                return node;
            }
        }

        throw new AiResponseException("Failed to parse JSON from response: " + preview(jsonText));
    }

    static String stripFences(String text) {
        String jsonText = text.trim();
        if (jsonText.startsWith("```json")) {
            jsonText = jsonText.substring(7);
        } else if (jsonText.startsWith("```")) {
            jsonText = jsonText.substring(3);
        }
        if (jsonText.endsWith("```")) {
            jsonText = jsonText.substring(0, jsonText.length() - 3);
        }
        return jsonText.trim();
    }

    /**
     * The first {...} span whose braces balance, ignoring braces inside string literals.
     */
    static String extractBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static JsonNode tryRead(String json) {
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String preview(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
