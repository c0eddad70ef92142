package com.vibeforge.core.artifact;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Human-readable label for an artifact: "bar chart of sales by region" → "bar_chart_sales_region".
 */
public final class SlugGenerator {

    static final int MAX_TOKENS        = 8;
    static final int MAX_LENGTH        = 40;
    static final int VARIABLE_ROOM_MAX = 35;
    static final String FALLBACK       = "widget";

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "in", "on", "at", "to", "for", "with", "by", "and", "or");

    private SlugGenerator() {}

    public static String slugFor(String description, String dataVariableName) {
        String normalized = Signatures.normalizeText(description).toLowerCase(Locale.ROOT);

        List<String> parts = new ArrayList<>();
        for (String word : normalized.split(" ")) {
            if (word.isEmpty() || STOP_WORDS.contains(word)) continue;
            if (parts.size() == MAX_TOKENS) break;
            String cleaned = word.replaceAll("[^\\p{Alnum}]", "_");
            if (!cleaned.isEmpty() && !cleaned.equals("_")) parts.add(cleaned);
        }

        String slug = collapse(String.join("_", parts));
        slug = truncate(slug, MAX_LENGTH);

        if (dataVariableName != null && !dataVariableName.isBlank() && slug.length() < VARIABLE_ROOM_MAX) {
            String var = dataVariableName.trim().replaceAll("[^\\p{Alnum}_]", "_");
            slug = truncate(collapse(slug + "_" + var), MAX_LENGTH);
        }

        slug = stripUnderscores(slug);
        return slug.isEmpty() ? FALLBACK : slug;
    }

    private static String collapse(String s) {
        return s.replaceAll("_{2,}", "_");
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static String stripUnderscores(String s) {
        int start = 0, end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }
}
