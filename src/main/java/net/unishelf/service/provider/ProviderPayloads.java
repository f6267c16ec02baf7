package net.unishelf.service.provider;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.databind.JsonNode;

/**
 * Null-tolerant readers for provider JSON payloads. Missing, null and blank
 * values all read as {@code null} so a sparse record never throws.
 */
public final class ProviderPayloads {

    private ProviderPayloads() {
        // Utility class
    }

    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        return text(node.path(field));
    }

    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainer()) {
            return null;
        }
        return emptyToNull(node.asString());
    }

    /**
     * Reads a JSON array of strings, skipping non-textual and blank entries.
     */
    public static List<String> textList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        JsonNode array = node.path(field);
        if (!array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            String value = text(element);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    public static String emptyToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
