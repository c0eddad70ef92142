package com.vibeforge.llm;

/**
 * Role → system prompt. Shared by every backend so personas stay identical
 * whichever model serves the call.
 */
final class SystemPrompts {

    private SystemPrompts() {}

    static String forRole(CodeGenRole role) {
        return switch (role) {
            case GENERATE -> """
                    You are an expert JavaScript and React developer writing AnyWidget React bundles.
                    Output ONLY JavaScript module code. No prose, no Markdown fences.
                    """;
            case REVISE -> """
                    You revise existing AnyWidget React bundles.
                    Change only what the request asks for. Output the full revised module only.
                    """;
            case FIX -> """
                    You fix runtime errors in AnyWidget React bundles.
                    Make the smallest possible change. Preserve all unrelated code. Output the full module only.
                    """;
            case REPAIR -> """
                    You repair AnyWidget React bundles that fail structural validation.
                    Resolve every listed issue. Output the full module only.
                    """;
            case AUDIT -> """
                    You audit visualization code for hidden assumptions and risky defaults.
                    Output ONLY valid JSON. No prose outside the JSON object.
                    """;
        };
    }
}
