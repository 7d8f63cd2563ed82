package com.delta.jobmatcher.match.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lenient readers over loosely shaped JSON coming from posting sources and model output.
 */
public final class JsonNodes {
    private JsonNodes() {
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull() || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    public static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static JsonNode firstPresent(JsonNode node, String... fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    public static Double number(JsonNode node, String... fields) {
        JsonNode value = firstPresent(node, fields);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Reads a list of strings. Object entries are reduced to their {@code skill}, {@code name}
     * or {@code title} field since models sometimes wrap plain values.
     */
    public static List<String> stringList(JsonNode node, String... fields) {
        JsonNode value = firstPresent(node, fields);
        List<String> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        if (value.isTextual()) {
            String single = value.asText().trim();
            if (!single.isEmpty()) {
                out.add(single);
            }
            return out;
        }
        if (!value.isArray()) {
            return out;
        }
        for (JsonNode child : value) {
            String item = null;
            if (child.isTextual() || child.isNumber()) {
                item = child.asText();
            } else if (child.isObject()) {
                item = firstText(child, "skill", "name", "title");
            }
            if (item != null && !item.isBlank()) {
                out.add(item.trim());
            }
        }
        return out;
    }

    public static Set<String> stringSet(JsonNode node, String... fields) {
        return new LinkedHashSet<>(stringList(node, fields));
    }
}
