package com.vibeforge.llm;

import java.util.regex.Pattern;

/** Strips Markdown code fences models wrap around code or JSON despite being told not to. */
public final class CodeFences {

    private static final Pattern OPENING = Pattern.compile(
            "```(?:javascript|jsx|json|js|typescript|tsx|ts)?[ \\t]*\\r?\\n?");
    private static final Pattern CLOSING = Pattern.compile("\\r?\\n?```[ \\t]*");

    private CodeFences() {}

    public static String strip(String text) {
        if (text == null) return "";
        String cleaned = OPENING.matcher(text).replaceAll("");
        cleaned = CLOSING.matcher(cleaned).replaceAll("");
        return cleaned.strip();
    }
}
