package com.openforge.memgraph.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.error.MalformedResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extraction and field validation for JSON embedded in model output.
 * Every failure is a {@link MalformedResponseException} naming the offending field.
 */
public final class LlmJson {

    private static final Pattern JSON_BLOCK =
            Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private LlmJson() {}

    /** Strips a markdown fence and any prose around the outermost JSON object or array. */
    public static JsonNode parse(ObjectMapper mapper, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Model returned an empty response");
        }
        String text = raw.trim();
        var m = JSON_BLOCK.matcher(text);
        if (m.find()) text = m.group(1).trim();

        int start = firstOf(text, '{', '[');
        if (start < 0) throw new MalformedResponseException("No JSON document in model output");
        char close = text.charAt(start) == '{' ? '}' : ']';
        int end = text.lastIndexOf(close);
        if (end <= start) throw new MalformedResponseException("Unterminated JSON document in model output");

        try {
            return mapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Model output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static JsonNode requireObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Expected a JSON object");
        }
        return node;
    }

    /** Array of strings; a bare string is accepted as a one-element array. Missing → empty. */
    public static List<String> stringList(JsonNode parent, String field, boolean required) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            if (required) throw new MalformedResponseException("Missing required field '" + field + "'");
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (value.isTextual()) {
            if (!value.asText().isBlank()) out.add(value.asText().trim());
            return out;
        }
        if (!value.isArray()) {
            throw new MalformedResponseException("Field '" + field + "' must be an array of strings");
        }
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new MalformedResponseException("Field '" + field + "' contains a non-string element");
            }
            if (!item.asText().isBlank()) out.add(item.asText().trim());
        }
        return out;
    }

    public static String requireText(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new MalformedResponseException("Missing or blank text field '" + field + "'");
        }
        return value.asText().trim();
    }

    public static String optionalText(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) return null;
        return value.asText().trim();
    }

    /** Number in [0, 1]; missing → {@code fallback}. */
    public static double probability(JsonNode parent, String field, double fallback) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isNumber()) {
            throw new MalformedResponseException("Field '" + field + "' must be a number");
        }
        double d = value.asDouble();
        if (d < 0 || d > 1) throw new MalformedResponseException("Field '" + field + "' outside [0, 1]: " + d);
        return d;
    }

    private static int firstOf(String text, char a, char b) {
        int ia = text.indexOf(a);
        int ib = text.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
