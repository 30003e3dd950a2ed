package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/** Lenient accessors for tool arguments. Presence of required keys is checked by the router. */
final class ToolArguments {

    private ToolArguments() {
    }

    static String text(JsonNode args, String key) {
        JsonNode node = args.get(key);
        return node == null || node.isNull() ? null : node.asText();
    }

    static String text(JsonNode args, String key, String fallback) {
        String value = text(args, key);
        return value == null ? fallback : value;
    }

    static int integer(JsonNode args, String key, int fallback) {
        Integer value = optionalInteger(args, key);
        return value == null ? fallback : value;
    }

    /** Accepts numbers and numeric strings; anything else is {@code null}. */
    static Integer optionalInteger(JsonNode args, String key) {
        JsonNode node = args.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return (int) Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " must be a number, got '" + node.asText() + "'");
            }
        }
        throw new IllegalArgumentException("Parameter " + key + " must be a number");
    }

    static boolean bool(JsonNode args, String key, boolean fallback) {
        JsonNode node = args.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isTextual()) {
            return Boolean.parseBoolean(node.asText());
        }
        return node.asBoolean(fallback);
    }

    static Map<String, String> stringMap(JsonNode args, String key) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode node = args.get(key);
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
        }
        return values;
    }
}
