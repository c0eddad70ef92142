package com.vibeforge.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GenerationState: mutable context threaded through one GenerationLoop run.
 *
 * Owned by a single loop invocation on a single thread; never shared.
 */
public class GenerationState {

    private static final Logger log = LoggerFactory.getLogger(GenerationState.class);

    private final String requestId;
    private final int    maxCollaboratorCalls;

    private GenerationPhase phase = GenerationPhase.ANALYZING;

    private String       code;
    private List<String> issues   = List.of();
    private List<String> warnings = List.of();

    private int collaboratorCalls = 0;

    private final List<RepairAttempt> repairHistory = new ArrayList<>();

    public GenerationState(String requestId, int maxRepairAttempts) {
        this.requestId            = requestId;
        this.maxCollaboratorCalls = maxRepairAttempts + 1;
    }

    // =========================================================================
    // Phase
    // =========================================================================

    public GenerationPhase getPhase() { return phase; }

    public void setPhase(GenerationPhase next) {
        if (this.phase != next) {
            log.debug("[State] {} phase transition: {} → {}", requestId, this.phase, next);
            this.phase = next;
        }
    }

    // =========================================================================
    // Budget
    // =========================================================================

    public void recordCollaboratorCall() {
        collaboratorCalls++;
    }

    public boolean hasCallBudget() {
        return collaboratorCalls < maxCollaboratorCalls;
    }

    public int getCollaboratorCalls() { return collaboratorCalls; }

    // =========================================================================
    // Code and findings
    // =========================================================================

    public String getCode()                  { return code; }
    public void   setCode(String code)       { this.code = code; }
    public boolean hasCode()                 { return code != null; }

    public List<String> getIssues()          { return issues; }
    public List<String> getWarnings()        { return warnings; }

    public void setFindings(List<String> issues, List<String> warnings) {
        this.issues   = List.copyOf(issues);
        this.warnings = List.copyOf(warnings);
    }

    public void addRepairAttempt(RepairAttempt attempt) {
        repairHistory.add(attempt);
    }

    public List<RepairAttempt> getRepairHistory() {
        return Collections.unmodifiableList(repairHistory);
    }

    public int getRepairCount() { return repairHistory.size(); }

    public String getRequestId() { return requestId; }
}
