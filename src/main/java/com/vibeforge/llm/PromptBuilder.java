package com.vibeforge.llm;

import com.vibeforge.core.audit.AuditLevel;
import com.vibeforge.core.data.DataContext;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * PromptBuilder: user-prompt bodies for each collaborator call.
 *
 * System prompts live in {@link SystemPrompts}; this class only renders the
 * task, the data schema and the state-sharing contract.
 */
@Component
public class PromptBuilder {

    static final String EXPORTS_HEADER = "EXPORTS (state shared with other widgets):";
    static final String IMPORTS_HEADER = "IMPORTS (state read from other widgets):";

    private static final String WIDGET_RULES = """
            RULES:
            1. export default function Widget({ model, html, React }) { ... }
            2. Markup uses html tagged templates (htm). No JSX, no ReactDOM.render.
            3. Read data with model.get("data") and guard it before iterating.
            4. Attach DOM through refs rendered inside html templates. Never touch document.body.
            5. Import libraries from an ESM CDN with pinned versions (d3@7, three@0.160).
            6. Set every export with model.set("name", value) and call model.save_changes().
            7. Subscribe to imports with model.on("change:name", handler) and unsubscribe in cleanup.
            8. Use class= not className= inside templates.
            9. Every React.useEffect returns a cleanup.
            Return only the JavaScript module. No Markdown fences, no explanations.
            """;

    // =========================================================================
    // Generation
    // =========================================================================

    public String buildGeneratePrompt(String description, DataContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("TASK: ").append(description).append("\n\n");
        appendDataSchema(sb, context);
        appendContract(sb, context);
        appendTheme(sb, context);
        sb.append(WIDGET_RULES);
        return sb.toString();
    }

    public String buildRevisePrompt(String baseCode, List<String> componentNames,
                                    String request, DataContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("REVISION REQUEST: ").append(request).append("\n\n");
        sb.append("CURRENT CODE:\n").append(baseCode).append("\n\n");
        if (componentNames != null && !componentNames.isEmpty()) {
            sb.append("AVAILABLE COMPONENTS in the current code: ")
              .append(String.join(", ", componentNames)).append("\n")
              .append("Reuse them where they fit instead of rewriting them.\n\n");
        }
        appendDataSchema(sb, context);
        appendContract(sb, context);
        appendTheme(sb, context);
        sb.append("Make only the requested changes and keep the existing structure.\n");
        sb.append(WIDGET_RULES);
        return sb.toString();
    }

    // =========================================================================
    // Repair
    // =========================================================================

    public String buildFixPrompt(String brokenCode, String errorText, String repairHint, DataContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Fix the runtime error below with the smallest possible change.\n")
          .append("Do not remove, rename, or rewrite unrelated code.\n\n");
        sb.append("ERROR MESSAGE:\n").append(errorText).append("\n\n");
        if (repairHint != null && !repairHint.isBlank()) {
            sb.append("HINT: ").append(repairHint).append("\n\n");
        }
        sb.append("BROKEN CODE:\n").append(brokenCode).append("\n\n");
        appendDataSchema(sb, context);
        appendContract(sb, context);
        sb.append(WIDGET_RULES);
        return sb.toString();
    }

    public String buildRepairPrompt(String code, Collection<String> issues, DataContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("The widget code below fails validation. Resolve every issue.\n\n");
        sb.append("ISSUES:\n");
        for (String issue : issues) sb.append("- ").append(issue).append("\n");
        sb.append("\nCODE:\n").append(code).append("\n\n");
        appendDataSchema(sb, context);
        appendContract(sb, context);
        sb.append(WIDGET_RULES);
        return sb.toString();
    }

    // =========================================================================
    // Audit
    // =========================================================================

    public String buildAuditPrompt(String code, String description, DataContext context,
                                   AuditLevel level, Collection<Integer> changedLines) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                Audit the widget for choices that could change what a reader concludes.
                Domains: DATA, COMPUTATION, PRESENTATION, INTERACTION.
                Concern ids are stable and scoped like "domain.type.short_name".
                Location is "global" or a list of 1-based line numbers from the code below.
                Default to low impact; reserve high for likely conclusion-changing choices.

                """);
        sb.append("Widget description: ").append(description != null ? description : "").append("\n");
        appendDataSchema(sb, context);
        appendContract(sb, context);

        if (changedLines != null && !changedLines.isEmpty()) {
            sb.append("CHANGED LINES (report only concerns tied to these lines, or truly code-wide ones):\n")
              .append(changedLines).append("\n\n");
        }

        sb.append("CODE WITH LINE NUMBERS:\n").append(numberLines(code)).append("\n");
        sb.append(level == AuditLevel.FULL ? FULL_SCHEMA : FAST_SCHEMA);
        return sb.toString();
    }

    static String numberLines(String code) {
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            sb.append(String.format("%4d | %s\n", i + 1, lines[i]));
        }
        return sb.toString();
    }

    private static final String FAST_SCHEMA = """
            Return ONLY JSON:
            {
              "fast_audit": {
                "concerns": [
                  {
                    "id": "data.selection.null_handling",
                    "location": "global" | [1, 2, 3],
                    "summary": "...",
                    "details": "...",
                    "technical_summary": "...",
                    "impact": "high" | "medium" | "low",
                    "default": true,
                    "alternatives": ["..."]
                  }
                ],
                "open_questions": ["..."]
              }
            }
            """;

    private static final String FULL_SCHEMA = """
            Return ONLY JSON:
            {
              "full_audit": {
                "concerns": [
                  {
                    "id": "computation.parameters.seed",
                    "location": "global" | [1, 2, 3],
                    "summary": "...",
                    "details": "...",
                    "impact": "high" | "medium" | "low",
                    "default": true,
                    "rationale": "...",
                    "alternatives": [
                      { "option": "...", "when_better": "...", "when_worse": "..." }
                    ],
                    "lenses": {
                      "uncertainty": "...",
                      "reproducibility": "...",
                      "edge_behavior": "...",
                      "default_vs_explicit": "...",
                      "appropriateness": "...",
                      "safety": "..."
                    }
                  }
                ],
                "open_questions": ["..."]
              }
            }
            """;

    // =========================================================================
    // Sections
    // =========================================================================

    private static void appendDataSchema(StringBuilder sb, DataContext context) {
        sb.append("Data schema:\n");
        if (context.getColumns().isEmpty()) {
            sb.append("- Columns: none (widget uses imports only)\n");
        } else {
            sb.append("- Columns: ").append(String.join(", ", context.getColumns())).append("\n");
            sb.append("- Types: ").append(context.getDtypes()).append("\n");
            sb.append("- Sample: ").append(context.getSample()).append("\n");
        }
        sb.append("- Shape: ").append(context.getShape().getRows()).append(" rows x ")
          .append(context.getShape().getColumns()).append(" columns\n");
        if (context.isGeospatial()) {
            sb.append("- Looks geospatial (lat/lon style columns present)\n");
        }
        if (!context.getTemporalColumns().isEmpty()) {
            sb.append("- Temporal columns: ").append(String.join(", ", context.getTemporalColumns())).append("\n");
        }
        sb.append("\n");
    }

    private static void appendContract(StringBuilder sb, DataContext context) {
        appendMapping(sb, EXPORTS_HEADER, context.getExports(),
                "Initialize exports on mount, update them on interaction, call model.save_changes().");
        appendMapping(sb, IMPORTS_HEADER, context.getImports(),
                "Subscribe with model.on(\"change:name\", handler) and unsubscribe in cleanup.");
    }

    private static void appendMapping(StringBuilder sb, String header, Map<String, String> mapping, String rule) {
        if (mapping.isEmpty()) return;
        sb.append(header).append("\n");
        mapping.forEach((name, text) -> sb.append("- ").append(name).append(": ").append(text).append("\n"));
        sb.append(rule).append("\n\n");
    }

    private static void appendTheme(StringBuilder sb, DataContext context) {
        if (context.getTheme() == null || context.getTheme().isBlank()) return;
        sb.append("THEME:\n").append(context.getTheme().trim()).append("\n\n");
    }
}
