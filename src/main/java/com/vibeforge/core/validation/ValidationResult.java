package com.vibeforge.core.validation;

import java.util.List;

/**
 * Outcome of {@link CodeValidator#validate}. {@code valid} is true iff there are no issues;
 * warnings never block acceptance.
 */
public final class ValidationResult {

    private final List<String> issues;
    private final List<String> warnings;

    public ValidationResult(List<String> issues, List<String> warnings) {
        this.issues   = List.copyOf(issues);
        this.warnings = List.copyOf(warnings);
    }

    public boolean      isValid()     { return issues.isEmpty(); }
    public List<String> getIssues()   { return issues; }
    public List<String> getWarnings() { return warnings; }

    public String getSummary() {
        return String.format("Found %d issues and %d warnings", issues.size(), warnings.size());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", issues=" + issues + ", warnings=" + warnings + "}";
    }
}
