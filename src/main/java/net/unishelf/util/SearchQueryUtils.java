package net.unishelf.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalization helpers for search input shared by controllers and services.
 */
public final class SearchQueryUtils {

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Trims the query and returns {@code null} when nothing searchable remains.
     */
    public static String normalizeOrNull(String query) {
        if (query == null) {
            return null;
        }
        String trimmed = query.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Splits a comma separated list, trimming entries and dropping blanks and duplicates
     * while keeping first-seen order.
     */
    public static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        Set<String> values = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return new ArrayList<>(values);
    }

    /**
     * Same as {@link #splitCsv(String)} for values that may already arrive as a list.
     */
    public static List<String> flattenCsv(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        return splitCsv(String.join(",", raw));
    }
}
