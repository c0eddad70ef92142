package com.vibeforge.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline backend. Emits a contract-conforming widget for every
 * code role (fenced, to exercise cleaning) and a small JSON report for AUDIT.
 */
@Component
@Profile("mock")
public class MockCodeModelClient implements CodeModelClient {

    private static final Pattern MAPPING_LINE = Pattern.compile("^- ([^:\\n]+):", Pattern.MULTILINE);
    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(\\d+) \\| (.*)$", Pattern.MULTILINE);

    @Override
    public String getModelId() {
        return "mock";
    }

    @Override
    public String generateWithRole(CodeGenRole role, String userPrompt, double temperature, Consumer<String> onChunk) {
        String text = role == CodeGenRole.AUDIT
                ? auditReport(userPrompt)
                : "```javascript\n" + widget(namesUnder(userPrompt, PromptBuilder.EXPORTS_HEADER),
                                             namesUnder(userPrompt, PromptBuilder.IMPORTS_HEADER)) + "```\n";
        if (onChunk != null) onChunk.accept(text);
        return text;
    }

    // =========================================================================
    // Code
    // =========================================================================

    private static String widget(List<String> exports, List<String> imports) {
        StringBuilder sb = new StringBuilder();
        sb.append("import * as d3 from \"https://esm.sh/d3@7\";\n\n");
        sb.append("export default function Widget({ model, html, React }) {\n");
        sb.append("  const data = model.get(\"data\") || [];\n");
        sb.append("  const containerRef = React.useRef(null);\n\n");
        sb.append("  React.useEffect(() => {\n");
        for (String name : exports) {
            sb.append("    model.set(\"").append(name).append("\", null);\n");
        }
        if (!exports.isEmpty()) {
            sb.append("    model.save_changes();\n");
        }
        for (String name : imports) {
            sb.append("    const on_").append(name).append(" = () => {};\n");
            sb.append("    model.on(\"change:").append(name).append("\", on_").append(name).append(");\n");
        }
        sb.append("    const svg = d3.select(containerRef.current).append(\"svg\").attr(\"height\", 420);\n");
        sb.append("    return () => svg.remove();\n");
        sb.append("  }, [data]);\n\n");
        sb.append("  return html`<div class=\"widget\" ref=${containerRef}></div>`;\n");
        sb.append("}\n");
        return sb.toString();
    }

    private static List<String> namesUnder(String prompt, String header) {
        List<String> names = new ArrayList<>();
        int start = prompt.indexOf(header);
        if (start < 0) return names;
        int end = prompt.indexOf("\n\n", start);
        String section = prompt.substring(start, end < 0 ? prompt.length() : end);
        Matcher m = MAPPING_LINE.matcher(section);
        while (m.find()) names.add(m.group(1).trim());
        return names;
    }

    // =========================================================================
    // Audit
    // =========================================================================

    private static String auditReport(String prompt) {
        String root = prompt.contains("\"full_audit\"") ? "full_audit" : "fast_audit";

        int dataLine = -1;
        Matcher m = NUMBERED_LINE.matcher(prompt);
        while (m.find()) {
            if (m.group(2).contains("model.get(\"data\")")) {
                dataLine = Integer.parseInt(m.group(1));
                break;
            }
        }
        String dataLocation = dataLine > 0 ? "[" + dataLine + "]" : "\"global\"";

        return """
                {
                  "%s": {
                    "concerns": [
                      {
                        "id": "data.selection.null_handling",
                        "location": %s,
                        "summary": "Missing data falls back to an empty list",
                        "details": "Rows that fail to load render as an empty chart instead of an error.",
                        "technical_summary": "model.get(\\"data\\") || []",
                        "impact": "low",
                        "default": true,
                        "alternatives": ["Show a placeholder when there is no data"]
                      },
                      {
                        "id": "presentation.layout.fixed_height",
                        "location": "global",
                        "summary": "Chart height is fixed",
                        "details": "The chart is always 420 pixels tall.",
                        "impact": "low",
                        "default": true,
                        "alternatives": ["Size the chart from its container"]
                      }
                    ],
                    "open_questions": ["Should an empty dataset show a message?"]
                  }
                }
                """.formatted(root, dataLocation);
    }
}
