package com.vibeforge.core.artifact;

import com.vibeforge.util.Fingerprint;
import com.vibeforge.util.StableJson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable signatures over the state-sharing contract and theme text.
 *
 * Absent or empty inputs hash to the empty string, so "no exports" and
 * "exports = {}" are the same key. Mapping order never matters.
 */
public final class Signatures {

    static final int SIGNATURE_LENGTH = 16;

    private Signatures() {}

    public static String ofMapping(Map<String, String> mapping) {
        if (mapping == null || mapping.isEmpty()) return "";
        List<List<String>> pairs = new ArrayList<>();
        for (Map.Entry<String, String> e : new TreeMap<>(mapping).entrySet()) {
            pairs.add(List.of(e.getKey(), e.getValue() != null ? e.getValue() : ""));
        }
        return truncate(Fingerprint.sha256(StableJson.stringify(Map.of("pairs", pairs))));
    }

    public static String ofTheme(String theme) {
        String normalized = normalizeText(theme);
        return normalized.isEmpty() ? "" : truncate(Fingerprint.sha256(normalized));
    }

    /** Trims and collapses every whitespace run to a single space. */
    public static String normalizeText(String text) {
        if (text == null) return "";
        return text.trim().replaceAll("\\s+", " ");
    }

    private static String truncate(String hash) {
        return hash.substring(0, SIGNATURE_LENGTH);
    }
}
