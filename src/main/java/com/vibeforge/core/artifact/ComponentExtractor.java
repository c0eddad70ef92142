package com.vibeforge.core.artifact;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight static scan for capitalized, exported top-level identifiers.
 *
 * Matches {@code export [default] function|const|let|class Name}. No parsing:
 * a later revision only needs the names to offer them back to the collaborator.
 */
public final class ComponentExtractor {

    private static final Pattern EXPORTED_COMPONENT = Pattern.compile(
            "^[ \\t]*export\\s+(?:default\\s+)?(?:async\\s+)?(?:function\\*?|const|let|class)\\s+([A-Z][A-Za-z0-9_$]*)",
            Pattern.MULTILINE);

    private ComponentExtractor() {}

    public static List<String> extract(String code) {
        if (code == null || code.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        Matcher m = EXPORTED_COMPONENT.matcher(code);
        while (m.find()) {
            names.add(m.group(1));
        }
        return List.copyOf(new ArrayList<>(names));
    }
}
