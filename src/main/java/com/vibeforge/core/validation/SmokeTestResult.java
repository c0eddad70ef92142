package com.vibeforge.core.validation;

import java.util.List;

/** Advisory load-time check result. A pass only means nothing failed immediately. */
public final class SmokeTestResult {

    private static final SmokeTestResult PASSED = new SmokeTestResult(List.of());

    private final List<String> issues;

    private SmokeTestResult(List<String> issues) {
        this.issues = List.copyOf(issues);
    }

    public static SmokeTestResult passed() {
        return PASSED;
    }

    public static SmokeTestResult failed(List<String> issues) {
        if (issues.isEmpty()) throw new IllegalArgumentException("A failed smoke test needs at least one issue");
        return new SmokeTestResult(issues);
    }

    public boolean      isSuccess() { return issues.isEmpty(); }
    public List<String> getIssues() { return issues; }

    @Override
    public String toString() {
        return isSuccess() ? "SmokeTestResult{success}" : "SmokeTestResult{issues=" + issues + "}";
    }
}
