package com.vibeforge.llm;

import java.util.function.Consumer;

/**
 * CodeModelClient: single raw interface to the code-generating model.
 *
 * One abstract method: generateWithRole(role, prompt, temperature, onChunk).
 * Backends that cannot stream call {@code onChunk} once with the whole text.
 * Prompt building, fence cleaning and timeouts belong to {@link WidgetCollaborator},
 * not to the backends.
 */
public interface CodeModelClient {

    /**
     * @param role        call purpose, selects the system prompt
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature
     * @param onChunk     optional incremental-text callback; may be null
     * @return the assembled response text, never null
     */
    String generateWithRole(CodeGenRole role, String userPrompt, double temperature, Consumer<String> onChunk);

    default String generateWithRole(CodeGenRole role, String userPrompt, double temperature) {
        return generateWithRole(role, userPrompt, temperature, null);
    }

    /** Informational backend/model name recorded on artifacts. Never part of a cache key. */
    String getModelId();

    /**
     * Canonical per-role temperatures.
     *
     * GENERATE 0.4 - room for visual variety
     * REVISE   0.3
     * REPAIR   0.2
     * FIX      0.1 - smallest possible change
     * AUDIT    0.0 - stable concern ids across runs
     */
    default double getTemperatureForRole(CodeGenRole role) {
        return switch (role) {
            case GENERATE -> 0.4;
            case REVISE   -> 0.3;
            case REPAIR   -> 0.2;
            case FIX      -> 0.1;
            case AUDIT    -> 0.0;
        };
    }
}
