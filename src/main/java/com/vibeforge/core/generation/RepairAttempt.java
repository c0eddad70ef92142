package com.vibeforge.core.generation;

import java.util.List;

/**
 * Immutable record of a single repair cycle (REPAIRING → VALIDATING).
 *
 * Captured by GenerationLoop after the follow-up validation, so the outcome
 * reflects what the repaired code actually looked like.
 */
public final class RepairAttempt {

    public enum Outcome {
        /** Follow-up validation found no issues. */
        RESOLVED,
        /** Repair call returned code, but validation still reports issues. */
        ISSUES_REMAIN,
        /** Repair call itself failed or timed out; previous code kept. */
        COLLABORATOR_FAILED
    }

    private final int            attemptNumber;
    private final RepairStrategy strategy;
    private final Outcome        outcome;

    /** Issues that were handed to the collaborator. */
    private final List<String>   issuesBefore;

    /** Issues after the follow-up validation; same as before on COLLABORATOR_FAILED. */
    private final List<String>   issuesAfter;

    /** Collaborator failure message, null unless COLLABORATOR_FAILED. */
    private final String         failureReason;

    private RepairAttempt(Builder b) {
        this.attemptNumber = b.attemptNumber;
        this.strategy      = b.strategy;
        this.outcome       = b.outcome;
        this.issuesBefore  = b.issuesBefore != null ? List.copyOf(b.issuesBefore) : List.of();
        this.issuesAfter   = b.issuesAfter != null ? List.copyOf(b.issuesAfter) : List.of();
        this.failureReason = b.failureReason;
    }

    // ----------------------------------------------------------------
    // Log rendering
    // ----------------------------------------------------------------

    public String toLogLine() {
        StringBuilder sb = new StringBuilder();
        sb.append("Repair #").append(attemptNumber)
          .append(" (").append(strategy).append("): ").append(outcome);
        switch (outcome) {
            case RESOLVED:
                sb.append(" - ").append(issuesBefore.size()).append(" issue(s) cleared");
                break;
            case ISSUES_REMAIN:
                sb.append(" - ").append(issuesAfter.size()).append(" issue(s) remain");
                break;
            case COLLABORATOR_FAILED:
                sb.append(" - ").append(failureReason);
                break;
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int            getAttemptNumber() { return attemptNumber; }
    public RepairStrategy getStrategy()      { return strategy; }
    public Outcome        getOutcome()       { return outcome; }
    public List<String>   getIssuesBefore()  { return issuesBefore; }
    public List<String>   getIssuesAfter()   { return issuesAfter; }
    public String         getFailureReason() { return failureReason; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int attemptNumber, RepairStrategy strategy, Outcome outcome) {
        return new Builder(attemptNumber, strategy, outcome);
    }

    public static final class Builder {
        private final int            attemptNumber;
        private final RepairStrategy strategy;
        private final Outcome        outcome;
        private List<String> issuesBefore  = null;
        private List<String> issuesAfter   = null;
        private String       failureReason = null;

        private Builder(int attemptNumber, RepairStrategy strategy, Outcome outcome) {
            this.attemptNumber = attemptNumber;
            this.strategy      = strategy;
            this.outcome       = outcome;
        }

        public Builder issuesBefore(List<String> v) { this.issuesBefore = v;  return this; }
        public Builder issuesAfter(List<String> v)  { this.issuesAfter = v;   return this; }
        public Builder failureReason(String v)      { this.failureReason = v; return this; }

        public RepairAttempt build() { return new RepairAttempt(this); }
    }

    @Override
    public String toString() {
        return "RepairAttempt{#" + attemptNumber + ", " + strategy + ", outcome=" + outcome + "}";
    }
}
