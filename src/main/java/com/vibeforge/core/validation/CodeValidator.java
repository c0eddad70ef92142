package com.vibeforge.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CodeValidator: structural checks on generated widget code. No I/O, no parsing.
 *
 * Issues (block acceptance):
 *   - no {@code export default function Name({ model, html, React })}
 *   - no {@code html`} template usage
 *   - a declared export never passed to {@code model.set(...)}, or no {@code model.save_changes()}
 *   - {@code document.body}, {@code ReactDOM.render}, {@code className=} inside htm templates
 *
 * Warnings (advisory):
 *   - a declared import never subscribed with {@code model.on("change:name", ...)}
 *   - a CDN import without a version pin
 */
@Component
public class CodeValidator {

    private static final Logger log = LoggerFactory.getLogger(CodeValidator.class);

    private static final String DEFAULT_EXPORT = "export default function";

    private static final Pattern DEFAULT_SIGNATURE =
            Pattern.compile("export\\s+default\\s+function\\s*[\\w$]*\\s*\\(([^)]*)\\)", Pattern.DOTALL);

    private static final Pattern CDN_IMPORT = Pattern.compile(
            "(?:from\\s+|import\\s*\\(?\\s*)[\"'](https://(?:esm\\.sh|cdn\\.jsdelivr\\.net/npm|unpkg\\.com|cdn\\.skypack\\.dev)/([^\"']+))[\"']");

    public ValidationResult validate(String code,
                                     Collection<String> expectedExports,
                                     Collection<String> expectedImports) {

        List<String> issues   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String src = code != null ? code : "";

        checkDefaultExport(src, issues);

        boolean usesHtm = src.contains("html`");
        if (!usesHtm) {
            issues.add("No html`...` template usage found - markup must use htm tagged templates");
        }

        checkExports(src, expectedExports, issues);
        checkImports(src, expectedImports, warnings);

        if (src.contains("document.body")) {
            issues.add("Direct document.body manipulation detected - use refs instead");
        }
        if (src.contains("ReactDOM.render")) {
            issues.add("ReactDOM.render not allowed - use html templates");
        }
        if (usesHtm && src.contains("className=")) {
            issues.add("Use 'class=' not 'className=' in htm templates");
        }

        checkCdnVersions(src, warnings);

        ValidationResult result = new ValidationResult(issues, warnings);
        log.debug("[Validator] {}", result.getSummary());
        return result;
    }

    // =========================================================================
    // Checks
    // =========================================================================

    private void checkDefaultExport(String src, List<String> issues) {
        if (!src.contains(DEFAULT_EXPORT)) {
            issues.add("Missing 'export default function' declaration");
            return;
        }
        Matcher m = DEFAULT_SIGNATURE.matcher(src);
        if (!m.find()) {
            issues.add("Malformed widget function declaration");
            return;
        }
        String params = m.group(1);
        boolean hasContract = containsWord(params, "model")
                && containsWord(params, "html")
                && containsWord(params, "React");
        if (!hasContract) {
            issues.add("Widget function must accept parameters { model, html, React }");
        }
    }

    private void checkExports(String src, Collection<String> exports, List<String> issues) {
        if (exports == null || exports.isEmpty()) return;

        boolean anyChecked = false;
        for (String name : exports) {
            // capitalized names are component exports, not shared state
            if (name.isEmpty() || Character.isUpperCase(name.charAt(0))) continue;
            anyChecked = true;
            if (!src.contains("model.set(\"" + name + "\"") && !src.contains("model.set('" + name + "'")) {
                issues.add("Export '" + name + "' never set with model.set()");
            }
        }
        if (anyChecked && !src.contains("model.save_changes()")) {
            issues.add("Missing model.save_changes() call for exports");
        }
    }

    private void checkImports(String src, Collection<String> imports, List<String> warnings) {
        if (imports == null) return;
        for (String name : imports) {
            if (!src.contains("model.on(\"change:" + name + "\"") && !src.contains("model.on('change:" + name + "'")) {
                warnings.add("Import '" + name + "' not subscribed with model.on()");
            }
        }
    }

    private void checkCdnVersions(String src, List<String> warnings) {
        Matcher m = CDN_IMPORT.matcher(src);
        while (m.find()) {
            String spec = m.group(2);
            String unscoped = spec.startsWith("@") ? spec.substring(1) : spec;
            String pkg = unscoped.contains("/") && spec.startsWith("@")
                    ? unscoped.substring(0, indexOfSecondSegmentEnd(unscoped))
                    : unscoped.split("/", 2)[0];
            if (!pkg.contains("@")) {
                warnings.add("CDN import '" + spec + "' missing version - should pin version (e.g., d3@7)");
            }
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /** For "scope/pkg@1/sub" returns the end index of "scope/pkg@1". */
    private static int indexOfSecondSegmentEnd(String unscoped) {
        int first = unscoped.indexOf('/');
        int second = unscoped.indexOf('/', first + 1);
        return second < 0 ? unscoped.length() : second;
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }
}
