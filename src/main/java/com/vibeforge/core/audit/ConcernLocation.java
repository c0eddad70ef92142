package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Where a concern applies: the sentinel {@code "global"} or a non-empty list of
 * 1-based line numbers. Serialized exactly that way.
 */
public final class ConcernLocation {

    public static final ConcernLocation GLOBAL = new ConcernLocation(List.of());

    private static final String GLOBAL_TOKEN = "global";

    private final List<Integer> lines;

    private ConcernLocation(List<Integer> lines) {
        this.lines = lines;
    }

    public static ConcernLocation lines(Collection<Integer> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A line location needs at least one line");
        }
        Set<Integer> distinct = new LinkedHashSet<>();
        for (Integer line : lines) {
            if (line == null || line < 1) {
                throw new IllegalArgumentException("Line numbers are 1-based, got " + line);
            }
            distinct.add(line);
        }
        return new ConcernLocation(List.copyOf(distinct));
    }

    public static ConcernLocation lines(Integer... lines) {
        return lines(List.of(lines));
    }

    public boolean       isGlobal() { return lines.isEmpty(); }
    public List<Integer> getLines() { return lines; }

    @JsonValue
    Object toJson() {
        return isGlobal() ? GLOBAL_TOKEN : lines;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ConcernLocation fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Location is required");
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (GLOBAL_TOKEN.equalsIgnoreCase(text)) return GLOBAL;
            return lines(parseLine(text));
        }
        if (node.isIntegralNumber()) {
            return lines(node.asInt());
        }
        if (node.isArray()) {
            List<Integer> parsed = new ArrayList<>();
            for (JsonNode item : node) {
                parsed.add(item.isIntegralNumber() ? item.asInt() : parseLine(item.asText()));
            }
            if (parsed.isEmpty()) {
                throw new IllegalArgumentException("Location list is empty");
            }
            return lines(parsed);
        }
        throw new IllegalArgumentException("Unsupported location: " + node);
    }

    private static int parseLine(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a line number: " + text, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConcernLocation && ((ConcernLocation) o).lines.equals(lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return isGlobal() ? GLOBAL_TOKEN : lines.toString();
    }
}
